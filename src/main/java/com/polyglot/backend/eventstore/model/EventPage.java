package com.polyglot.backend.eventstore.model;

import com.polyglot.backend.eventstore.entity.TranslationEventEntity;

import java.util.List;

/** listByUser 的結果：hasMore 靠多抓一筆判斷，不做 count(*) */
public record EventPage(
        List<TranslationEventEntity> events,
        int page,
        int perPage,
        boolean hasMore
) {}
