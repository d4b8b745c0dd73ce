package com.polyglot.backend.history.service;

import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.eventstore.model.EventPage;
import com.polyglot.backend.eventstore.model.TranslationType;
import com.polyglot.backend.eventstore.service.EventStore;
import com.polyglot.backend.history.dto.HistoryDtos;
import com.polyglot.backend.translation.language.SupportedLanguages;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@RequiredArgsConstructor
@Service
public class HistoryService {

    public static final int DEFAULT_SEARCH_LIMIT = 50;
    public static final int MAX_SEARCH_LIMIT = 100;

    private static final char LIKE_ESCAPE = '!';

    private final EventStore eventStore;
    private final SupportedLanguages languages;

    @Transactional(readOnly = true)
    public HistoryDtos.HistoryPageResponse list(String email, String typeRaw, Integer page, Integer perPage) {
        TranslationType type = null;
        if (typeRaw != null && !typeRaw.isBlank()) {
            type = TranslationType.fromWireOrNull(typeRaw);
            if (type == null) throw new InvalidInputException("INVALID_TRANSLATION_TYPE", "Invalid translation type: " + typeRaw);
        }

        EventPage p = eventStore.listByUser(
                email,
                type,
                page == null ? 1 : page,
                perPage == null ? EventStore.DEFAULT_PER_PAGE : perPage
        );

        var items = p.events().stream().map(e -> TranslationItems.from(e, languages)).toList();
        return new HistoryDtos.HistoryPageResponse(
                true,
                items,
                new HistoryDtos.Pagination(p.page(), p.perPage(), p.hasMore())
        );
    }

    @Transactional(readOnly = true)
    public HistoryDtos.TranslationItem get(String email, Long id) {
        return TranslationItems.from(eventStore.getById(email, id), languages);
    }

    /**
     * 不分大小寫的子字串搜尋（原文 / 譯文）。
     * 排序在 DB 端做：相關度高的在前，同分新的在前。
     */
    @Transactional(readOnly = true)
    public HistoryDtos.SearchResponse search(String email, String query, Integer limitParam) {
        String q = query == null ? "" : query.trim();
        if (q.isEmpty()) throw new InvalidInputException("QUERY_REQUIRED", "Search query is required");

        int limit = (limitParam == null) ? DEFAULT_SEARCH_LIMIT : Math.max(1, Math.min(limitParam, MAX_SEARCH_LIMIT));
        String needle = q.toLowerCase(Locale.ROOT);

        var results = eventStore.search(email, needle, "%" + escapeLike(needle) + "%", limit).stream()
                .map(e -> TranslationItems.from(e, languages))
                .toList();

        return new HistoryDtos.SearchResponse(true, results, results.size(), q);
    }

    /**
     * confirm 必須明確是 true，否則不動任何資料。
     */
    public HistoryDtos.ClearResponse clear(String email, Boolean confirm) {
        if (!Boolean.TRUE.equals(confirm)) {
            throw new InvalidInputException("CONFIRMATION_REQUIRED", "Confirmation required. Add confirm=true to clear history");
        }

        int deleted = eventStore.deleteAllForUser(email);
        return new HistoryDtos.ClearResponse(true, deleted, "Cleared " + deleted + " translations from history");
    }

    // ===== helpers =====

    /** LIKE 用：跳脫 ! % _（escape 字元是 !） */
    static String escapeLike(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == LIKE_ESCAPE || c == '%' || c == '_') sb.append(LIKE_ESCAPE);
            sb.append(c);
        }
        return sb.toString();
    }
}
