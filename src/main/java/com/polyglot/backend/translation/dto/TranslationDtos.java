package com.polyglot.backend.translation.dto;

import com.polyglot.backend.eventstore.model.TranslationType;

import java.util.List;

public class TranslationDtos {

    /**
     * POST /api/v1/translate
     * 語言可以給 code（source_lang）或名稱（source_lang_name），code 優先。
     */
    public record TranslateRequest(
            String text,
            String sourceLang,
            String targetLang,
            String sourceLangName,
            String targetLangName,
            String translationType
    ) {}

    /** Gateway 的輸入（已經帶上來源位址等 metadata） */
    public record TranslateCommand(
            String userEmail,
            String text,
            String sourceLang,
            String targetLang,
            String translationType,
            String ipAddress,
            String userAgent
    ) {}

    /** Gateway 成功結果 */
    public record TranslationOutcome(
            Long eventId,
            String originalText,
            String translatedText,
            String sourceLang,
            String targetLang,
            TranslationType translationType,
            int characterCount,
            long elapsedMs,
            Double confidence,
            int attempts
    ) {}

    public record TranslateResponse(
            boolean success,
            Long translationId,
            String originalText,
            String translatedText,
            String sourceLang,
            String targetLang,
            String sourceLangName,
            String targetLangName,
            TranslationType translationType,
            int characterCount,
            long translationTimeMs,
            Double confidenceScore,
            int attempts
    ) {}

    public record LanguageItem(String code, String name) {}

    public record LanguagesResponse(
            boolean success,
            List<LanguageItem> languages,
            int count
    ) {}
}
