package com.polyglot.backend.users.service;

import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.translation.language.SupportedLanguages;
import com.polyglot.backend.users.dto.UserDtos;
import com.polyglot.backend.users.entity.UserAccountEntity;
import com.polyglot.backend.users.repo.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * 帳號生命週期由外部負責；這裡只有：
 * - 登入時建立 / 更新 last_login
 * - 讀個人資料
 * - 改偏好語言
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class UserAccountService {

    private final UserAccountRepository repo;
    private final SupportedLanguages languages;
    private final Clock clock;

    @Transactional
    public UserDtos.UserInfo touchLogin(String email, String fullName) {
        Instant now = clock.instant();

        UserAccountEntity u = repo.findById(email).orElseGet(() -> {
            UserAccountEntity fresh = new UserAccountEntity();
            fresh.setEmail(email);
            fresh.setFullName(defaultName(email));
            fresh.setCreatedAt(now);
            log.info("user created email={}", email);
            return fresh;
        });

        if (fullName != null && !fullName.isBlank()) u.setFullName(fullName.trim());
        u.setLastLoginAt(now);
        u.setUpdatedAt(now);

        return toInfo(repo.save(u));
    }

    @Transactional(readOnly = true)
    public UserDtos.UserInfo profile(String email) {
        return toInfo(requireUser(email));
    }

    @Transactional
    public UserDtos.UserInfo updatePreferences(String email, String sourceLang, String targetLang) {
        UserAccountEntity u = requireUser(email);

        if (sourceLang != null) u.setPreferredSourceLang(requireLanguage(sourceLang, "INVALID_SOURCE_LANGUAGE"));
        if (targetLang != null) u.setPreferredTargetLang(requireLanguage(targetLang, "INVALID_TARGET_LANGUAGE"));
        u.setUpdatedAt(clock.instant());

        return toInfo(repo.save(u));
    }

    @Transactional(readOnly = true)
    public UserAccountEntity requireUser(String email) {
        return repo.findById(email)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User not found: " + email));
    }

    public static UserDtos.UserInfo toInfo(UserAccountEntity u) {
        return new UserDtos.UserInfo(
                u.getEmail(),
                u.getFullName(),
                u.getPreferredSourceLang(),
                u.getPreferredTargetLang(),
                u.getTotalTranslations(),
                u.getTotalCharacters(),
                u.getCreatedAt(),
                u.getLastLoginAt()
        );
    }

    // ===== helpers =====

    private String requireLanguage(String raw, String errorCode) {
        String code = languages.resolve(raw);
        if (code == null) throw new InvalidInputException(errorCode, "Unsupported language: " + raw);
        return code;
    }

    private static String defaultName(String email) {
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
