package com.polyglot.backend.eventstore.model;

/**
 * Gateway 成功後交給 EventStore.append 的內容；createdAt 由 EventStore 蓋章。
 */
public record NewTranslationEvent(
        String userEmail,
        String sourceLanguage,
        String targetLanguage,
        String originalText,
        String translatedText,
        TranslationType translationType,
        int characterCount,
        long elapsedMs,
        Double confidence,
        String ipAddress,
        String userAgent
) {}
