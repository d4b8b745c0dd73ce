package com.polyglot.backend.history.dto;

import com.polyglot.backend.eventstore.model.TranslationType;

import java.time.Instant;
import java.util.List;

public class HistoryDtos {

    public record TranslationItem(
            Long id,
            String originalText,
            String translatedText,
            String sourceLanguage,
            String targetLanguage,
            String sourceLanguageName,
            String targetLanguageName,
            TranslationType translationType,
            int characterCount,
            long translationTimeMs,
            Double confidenceScore,
            Instant createdAt
    ) {}

    public record Pagination(int page, int perPage, boolean hasMore) {}

    public record HistoryPageResponse(
            boolean success,
            List<TranslationItem> translations,
            Pagination pagination
    ) {}

    public record TranslationResponse(boolean success, TranslationItem translation) {}

    public record SearchResponse(
            boolean success,
            List<TranslationItem> results,
            int count,
            String query
    ) {}

    public record ClearResponse(boolean success, int deletedCount, String message) {}
}
