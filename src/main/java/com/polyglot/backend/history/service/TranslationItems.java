package com.polyglot.backend.history.service;

import com.polyglot.backend.eventstore.entity.TranslationEventEntity;
import com.polyglot.backend.history.dto.HistoryDtos;
import com.polyglot.backend.translation.language.SupportedLanguages;

/** entity → 對外的 TranslationItem */
public final class TranslationItems {

    private TranslationItems() {}

    public static HistoryDtos.TranslationItem from(TranslationEventEntity e, SupportedLanguages languages) {
        return new HistoryDtos.TranslationItem(
                e.getId(),
                e.getOriginalText(),
                e.getTranslatedText(),
                e.getSourceLanguage(),
                e.getTargetLanguage(),
                languages.nameOf(e.getSourceLanguage()),
                languages.nameOf(e.getTargetLanguage()),
                e.getTranslationType(),
                e.getCharacterCount(),
                e.getTranslationTimeMs(),
                e.getConfidenceScore(),
                e.getCreatedAt()
        );
    }
}
