package com.polyglot.backend.translation.service;

import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.common.error.PersistenceUnavailableException;
import com.polyglot.backend.common.error.UpstreamUnavailableException;
import com.polyglot.backend.eventstore.model.NewTranslationEvent;
import com.polyglot.backend.eventstore.model.TranslationType;
import com.polyglot.backend.eventstore.service.EventStore;
import com.polyglot.backend.translation.config.TranslatorProperties;
import com.polyglot.backend.translation.dto.TranslationDtos;
import com.polyglot.backend.translation.language.SupportedLanguages;
import com.polyglot.backend.translation.limiter.UserCooldownLimiter;
import com.polyglot.backend.translation.provider.TranslationProvider;
import com.polyglot.backend.translation.provider.TranslationProvider.ProviderResult;
import com.polyglot.backend.translation.retry.BackoffSleeper;
import com.polyglot.backend.translation.retry.TranslationRetryPolicy;
import com.polyglot.backend.users.repo.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;

/**
 * 翻譯入口：驗證 → 冷卻（admission）→ 呼叫 provider（含重試）→ 寫一筆事件。
 * 這裡不開 transaction：provider I/O 與 backoff 期間不持有任何鎖或 DB 連線。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class TranslationGateway {

    private final TranslationProvider provider;
    private final UserCooldownLimiter limiter;
    private final BackoffSleeper sleeper;
    private final EventStore eventStore;
    private final UserAccountRepository userRepo;
    private final SupportedLanguages languages;
    private final TranslatorProperties props;
    private final Clock clock;

    public TranslationDtos.TranslationOutcome translate(TranslationDtos.TranslateCommand cmd) {
        // 1) 驗證：失敗不消耗冷卻
        String text = requireText(cmd.text());
        String source = requireLanguage(cmd.sourceLang(), "INVALID_SOURCE_LANGUAGE", "source");
        String target = requireLanguage(cmd.targetLang(), "INVALID_TARGET_LANGUAGE", "target");
        TranslationType type = requireType(cmd.translationType());

        if (!userRepo.existsById(cmd.userEmail())) {
            throw new NotFoundException("USER_NOT_FOUND", "User not found: " + cmd.userEmail());
        }

        // 2) admission：被接受的當下就開始冷卻
        limiter.admitOrThrow(cmd.userEmail(), clock.instant());
        long startMs = clock.millis();

        // 3) provider + retry
        int attempts = 0;
        ProviderResult result = null;
        while (!TranslationRetryPolicy.shouldGiveUp(attempts)) {
            int next = attempts + 1;
            if (next > 1) backoff(next, attempts, result);

            result = provider.translate(text, source, target);
            attempts = next;

            if (result.isOk()) break;

            if (result.status() == ProviderResult.Status.PERMANENT) {
                log.warn("provider rejected user={} pair={}-{} code={} detail={}",
                        cmd.userEmail(), source, target, result.errorCode(), result.detail());
                throw permanentFailure(result, attempts);
            }

            log.warn("provider attempt {}/{} failed user={} code={} detail={}",
                    attempts, TranslationRetryPolicy.MAX_ATTEMPTS, cmd.userEmail(), result.errorCode(), result.detail());
        }

        if (result == null || !result.isOk()) {
            String lastCode = result == null ? null : result.errorCode();
            log.warn("provider give up user={} attempts={} lastCode={}", cmd.userEmail(), attempts, lastCode);
            throw new UpstreamUnavailableException(
                    "PROVIDER_GIVE_UP",
                    "Translation service is temporarily unavailable, please try again later",
                    attempts,
                    lastCode
            );
        }

        long elapsedMs = Math.max(0, clock.millis() - startMs);
        int characters = text.codePointCount(0, text.length());

        // 4) 一筆事件（event + rollup + counters），寫不進去就整個算失敗
        Long eventId;
        try {
            eventId = eventStore.append(new NewTranslationEvent(
                    cmd.userEmail(),
                    source,
                    target,
                    text,
                    result.translatedText(),
                    type,
                    characters,
                    elapsedMs,
                    result.confidence(),
                    cmd.ipAddress(),
                    cmd.userAgent()
            ));
        } catch (DataAccessException | TransactionException e) {
            log.error("translation not recorded user={} pair={}-{}", cmd.userEmail(), source, target, e);
            throw new PersistenceUnavailableException(
                    "TRANSLATION_NOT_RECORDED",
                    "Translation could not be recorded, please try again later",
                    e
            );
        }

        log.info("translation ok id={} user={} pair={}-{} chars={} elapsedMs={} attempts={}",
                eventId, cmd.userEmail(), source, target, characters, elapsedMs, attempts);

        return new TranslationDtos.TranslationOutcome(
                eventId,
                text,
                result.translatedText(),
                source,
                target,
                type,
                characters,
                elapsedMs,
                result.confidence(),
                attempts
        );
    }

    // ===== helpers =====

    private void backoff(int nextAttempt, int attemptsDone, ProviderResult last) {
        Duration wait = TranslationRetryPolicy.delayBefore(nextAttempt);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(
                    "PROVIDER_INTERRUPTED",
                    "Translation was interrupted",
                    attemptsDone,
                    last == null ? null : last.errorCode()
            );
        }
    }

    private static RuntimeException permanentFailure(ProviderResult result, int attempts) {
        // provider 說請求本身有問題（通常是它不支援的語言組合）→ 400
        if ("PROVIDER_BAD_REQUEST".equals(result.errorCode())) {
            return new InvalidInputException("PROVIDER_REJECTED_INPUT",
                    "The translation service rejected this request");
        }
        return new UpstreamUnavailableException(
                "PROVIDER_REJECTED",
                "Translation service is unavailable",
                attempts,
                result.errorCode()
        );
    }

    private String requireText(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty()) throw new InvalidInputException("TEXT_REQUIRED", "Text is required");

        int max = props.getMaxTextLength();
        int len = text.codePointCount(0, text.length());
        if (len > max) {
            throw new InvalidInputException("TEXT_TOO_LONG",
                    "Text too long. Maximum " + max + " characters allowed");
        }
        return text;
    }

    private String requireLanguage(String raw, String errorCode, String role) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException(errorCode, "The " + role + " language is required");
        }
        String code = languages.resolve(raw);
        if (code == null) throw new InvalidInputException(errorCode, "Invalid " + role + " language: " + raw);
        return code;
    }

    private static TranslationType requireType(String raw) {
        if (raw == null || raw.isBlank()) return TranslationType.TEXT;
        TranslationType t = TranslationType.fromWireOrNull(raw);
        if (t == null) throw new InvalidInputException("INVALID_TRANSLATION_TYPE", "Invalid translation type: " + raw);
        return t;
    }
}
