package com.polyglot.backend.eventstore.service;

import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.eventstore.entity.LanguagePairRollupEntity;
import com.polyglot.backend.eventstore.entity.TranslationEventEntity;
import com.polyglot.backend.eventstore.model.EventPage;
import com.polyglot.backend.eventstore.model.EventSlice;
import com.polyglot.backend.eventstore.model.NewTranslationEvent;
import com.polyglot.backend.eventstore.model.TranslationType;
import com.polyglot.backend.eventstore.repo.LanguagePairRollupRepository;
import com.polyglot.backend.eventstore.repo.TranslationEventRepository;
import com.polyglot.backend.users.entity.UserAccountEntity;
import com.polyglot.backend.users.repo.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * 翻譯事件帳本 + 使用者計數 + 語言對 rollup。
 * 寫入一律先鎖使用者那一列：同一使用者的寫入串行化，不同使用者互不阻塞。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class EventStore {

    public static final int DEFAULT_PER_PAGE = 20;
    public static final int MAX_PER_PAGE = 100;

    private final TranslationEventRepository eventRepo;
    private final LanguagePairRollupRepository rollupRepo;
    private final UserAccountRepository userRepo;
    private final Clock clock;

    /**
     * 一個 transaction 內完成：insert 事件、upsert rollup、使用者計數 +1。
     * 任何一步失敗整筆 rollback。
     */
    @Transactional
    public Long append(NewTranslationEvent ev) {
        UserAccountEntity user = lockUser(ev.userEmail());

        // ✅ 拿到鎖之後才取時間：同一使用者的 created_at 不會倒退
        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);

        TranslationEventEntity e = new TranslationEventEntity();
        e.setUserEmail(ev.userEmail());
        e.setSourceLanguage(ev.sourceLanguage());
        e.setTargetLanguage(ev.targetLanguage());
        e.setOriginalText(ev.originalText());
        e.setTranslatedText(ev.translatedText());
        e.setTranslationType(ev.translationType() == null ? TranslationType.TEXT : ev.translationType());
        e.setCharacterCount(ev.characterCount());
        e.setTranslationTimeMs(ev.elapsedMs());
        e.setConfidenceScore(ev.confidence());
        e.setIpAddress(truncate(ev.ipAddress(), 64));
        e.setUserAgent(truncate(ev.userAgent(), 512));
        e.setCreatedAt(now);
        eventRepo.save(e);

        LanguagePairRollupEntity rollup = rollupRepo
                .findByUserEmailAndSourceLanguageAndTargetLanguage(ev.userEmail(), ev.sourceLanguage(), ev.targetLanguage())
                .orElseGet(() -> {
                    LanguagePairRollupEntity fresh = new LanguagePairRollupEntity();
                    fresh.setUserEmail(ev.userEmail());
                    fresh.setSourceLanguage(ev.sourceLanguage());
                    fresh.setTargetLanguage(ev.targetLanguage());
                    return fresh;
                });
        rollup.apply(ev.characterCount(), ev.elapsedMs(), ev.confidence(), now, day);
        rollupRepo.save(rollup);

        user.addTranslation(ev.characterCount(), now);

        log.debug("event appended id={} user={} pair={}", e.getId(), ev.userEmail(), rollup.pair());
        return e.getId();
    }

    @Transactional(readOnly = true)
    public TranslationEventEntity getById(String email, Long id) {
        return eventRepo.findByIdAndUserEmail(id, email)
                .orElseThrow(() -> new NotFoundException("TRANSLATION_NOT_FOUND", "Translation not found: " + id));
    }

    /**
     * page 從 1 開始；perPage 預設 20、上限 100。
     */
    @Transactional(readOnly = true)
    public EventPage listByUser(String email, TranslationType type, int page, int perPage) {
        int p = Math.max(1, page);
        int size = clampPerPage(perPage);

        var pageable = PageRequest.of(p - 1, size);
        Slice<TranslationEventEntity> slice = (type == null)
                ? eventRepo.sliceByUser(email, pageable)
                : eventRepo.sliceByUserAndType(email, type, pageable);

        return new EventPage(slice.getContent(), p, size, slice.hasNext());
    }

    /** 最新 n 筆 */
    @Transactional(readOnly = true)
    public List<TranslationEventEntity> recent(String email, int n) {
        return eventRepo.sliceByUser(email, PageRequest.of(0, Math.max(1, n))).getContent();
    }

    /** [from, to) 區間內的統計投影，舊到新 */
    @Transactional(readOnly = true)
    public List<EventSlice> slices(String email, Instant from, Instant to) {
        return eventRepo.findSlices(email, from, to);
    }

    @Transactional(readOnly = true)
    public List<LanguagePairRollupEntity> rollups(String email) {
        return rollupRepo.findByUserEmail(email);
    }

    /** 依相關度、再依新舊排好，最多 limit 筆 */
    @Transactional(readOnly = true)
    public List<TranslationEventEntity> search(String email, String needle, String likePattern, int limit) {
        return eventRepo.searchRanked(email, needle, likePattern, PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * 刪掉使用者全部事件與 rollup，計數歸零；已經是空的就回 0（冪等）。
     */
    @Transactional
    public int deleteAllForUser(String email) {
        UserAccountEntity user = lockUser(email);

        int deleted = eventRepo.deleteAllByUserEmail(email);
        int rollups = rollupRepo.deleteAllByUserEmail(email);
        user.resetCounters(clock.instant());

        log.info("history cleared user={} events={} rollups={}", email, deleted, rollups);
        return deleted;
    }

    /**
     * 把某個語言對標成（或取消）最愛；同一使用者最多一組。
     */
    @Transactional
    public LanguagePairRollupEntity setFavoritePair(String email, String source, String target, boolean favorite) {
        lockUser(email);

        LanguagePairRollupEntity rollup = rollupRepo
                .findByUserEmailAndSourceLanguageAndTargetLanguage(email, source, target)
                .orElseThrow(() -> new NotFoundException("LANGUAGE_PAIR_NOT_FOUND",
                        "No translations recorded for pair " + source + "-" + target));

        if (favorite) {
            rollupRepo.findByUserEmail(email).forEach(r -> r.setFavorite(false));
        }
        rollup.setFavorite(favorite);
        return rollup;
    }

    public static int clampPerPage(int perPage) {
        if (perPage <= 0) return DEFAULT_PER_PAGE;
        return Math.min(perPage, MAX_PER_PAGE);
    }

    // ===== helpers =====

    private UserAccountEntity lockUser(String email) {
        return userRepo.findByEmailForUpdate(email)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User not found: " + email));
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
