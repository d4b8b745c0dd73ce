package com.polyglot.backend.eventstore.model;

import java.time.Instant;

/**
 * 統計用的輕量投影（不含原文/譯文），由 JPQL constructor expression 產生。
 */
public record EventSlice(
        Long id,
        String sourceLanguage,
        String targetLanguage,
        TranslationType translationType,
        int characterCount,
        long elapsedMs,
        Double confidence,
        Instant createdAt
) {
    public String pair() {
        return sourceLanguage + "-" + targetLanguage;
    }
}
