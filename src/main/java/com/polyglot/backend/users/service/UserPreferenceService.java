package com.polyglot.backend.users.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.users.dto.UserDtos;
import com.polyglot.backend.users.entity.UserPreferenceEntity;
import com.polyglot.backend.users.model.PreferenceCategory;
import com.polyglot.backend.users.repo.UserAccountRepository;
import com.polyglot.backend.users.repo.UserPreferenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 任意 key/value 偏好（UI、音訊、隱私…），依 category 分組。
 * 兩個偏好語言不在這裡，仍然是 users 表上的欄位。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class UserPreferenceService {

    public static final int MAX_KEY_LENGTH = 100;
    public static final int MAX_VALUE_LENGTH = 16_384;

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final UserPreferenceRepository repo;
    private final UserAccountRepository userRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 沒有就新增，有就覆寫 value / category（停用中的會重新啟用）。
     */
    @Transactional
    public UserDtos.PreferenceItem setPreference(String email, String keyRaw, JsonNode value, String categoryRaw) {
        String key = requireKey(keyRaw);
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new InvalidInputException("PREFERENCE_VALUE_REQUIRED", "Preference value is required");
        }
        PreferenceCategory category = PreferenceCategory.fromWireOrDefault(categoryRaw);
        if (category == null) {
            throw new InvalidInputException("INVALID_PREFERENCE_CATEGORY", "Invalid preference category: " + categoryRaw);
        }
        String json = writeJson(value);
        if (json.length() > MAX_VALUE_LENGTH) {
            throw new InvalidInputException("PREFERENCE_VALUE_TOO_LONG", "Preference value is too long");
        }

        // ✅ 先鎖使用者：同一使用者同一 key 的並發 upsert 不會撞 unique key
        userRepo.findByEmailForUpdate(email)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User not found: " + email));

        Instant now = clock.instant();
        UserPreferenceEntity p = repo.findByUserEmailAndPreferenceKey(email, key).orElseGet(() -> {
            UserPreferenceEntity fresh = new UserPreferenceEntity();
            fresh.setUserEmail(email);
            fresh.setPreferenceKey(key);
            fresh.setCreatedAt(now);
            return fresh;
        });
        p.setPreferenceValue(json);
        p.setCategory(category);
        p.setActive(true);
        p.setUpdatedAt(now);

        UserPreferenceEntity saved = repo.save(p);
        log.debug("preference set user={} key={} category={}", email, key, category.wire());
        return toItem(saved);
    }

    @Transactional(readOnly = true)
    public UserDtos.PreferenceItem getPreference(String email, String keyRaw) {
        String key = requireKey(keyRaw);
        requireUser(email);
        return repo.findByUserEmailAndPreferenceKeyAndActiveTrue(email, key)
                .map(this::toItem)
                .orElseThrow(() -> new NotFoundException("PREFERENCE_NOT_FOUND", "Preference not found: " + key));
    }

    /** category → (key → value)；category、key 都依字母排序 */
    @Transactional(readOnly = true)
    public Map<String, Map<String, JsonNode>> allPreferences(String email) {
        requireUser(email);

        List<UserPreferenceEntity> rows = repo.findByUserEmailAndActiveTrueOrderByPreferenceKeyAsc(email);
        Map<String, Map<String, JsonNode>> out = new LinkedHashMap<>();
        rows.stream()
                .sorted(Comparator.comparing((UserPreferenceEntity p) -> p.getCategory().wire())
                        .thenComparing(UserPreferenceEntity::getPreferenceKey))
                .forEach(p -> out.computeIfAbsent(p.getCategory().wire(), k -> new LinkedHashMap<>())
                        .put(p.getPreferenceKey(), readJson(p)));
        return out;
    }

    // ===== helpers =====

    private UserDtos.PreferenceItem toItem(UserPreferenceEntity p) {
        return new UserDtos.PreferenceItem(p.getPreferenceKey(), p.getCategory(), readJson(p), p.getUpdatedAt());
    }

    private void requireUser(String email) {
        if (!userRepo.existsById(email)) {
            throw new NotFoundException("USER_NOT_FOUND", "User not found: " + email);
        }
    }

    static String requireKey(String raw) {
        String key = raw == null ? "" : raw.trim();
        if (key.isEmpty() || key.length() > MAX_KEY_LENGTH || !KEY_PATTERN.matcher(key).matches()) {
            throw new InvalidInputException("INVALID_PREFERENCE_KEY",
                    "Preference key must be 1-" + MAX_KEY_LENGTH + " characters of letters, digits, '.', '_' or '-'");
        }
        return key;
    }

    private String writeJson(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("PREFERENCE_VALUE_INVALID", "Preference value is not valid JSON");
        }
    }

    private JsonNode readJson(UserPreferenceEntity p) {
        try {
            return objectMapper.readTree(p.getPreferenceValue());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("PREFERENCE_VALUE_CORRUPT: " + p.getUserEmail() + "/" + p.getPreferenceKey(), e);
        }
    }
}
