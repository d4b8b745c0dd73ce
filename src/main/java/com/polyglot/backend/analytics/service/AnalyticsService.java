package com.polyglot.backend.analytics.service;

import com.polyglot.backend.analytics.dto.AnalyticsViews;
import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.eventstore.entity.LanguagePairRollupEntity;
import com.polyglot.backend.eventstore.model.EventSlice;
import com.polyglot.backend.eventstore.service.EventStore;
import com.polyglot.backend.history.service.TranslationItems;
import com.polyglot.backend.translation.language.SupportedLanguages;
import com.polyglot.backend.users.dto.UserDtos;
import com.polyglot.backend.users.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * 讀取端報表：從 EventStore 取事件投影 / rollup，交給 {@link AnalyticsCalculator} 計算。
 * 「今天」與日期邊界用伺服器 UTC。
 */
@RequiredArgsConstructor
@Service
public class AnalyticsService {

    public static final int DASHBOARD_RECENT = 5;
    public static final int DASHBOARD_TOP_PAIRS = 5;
    public static final int STATISTICS_TOP_PAIRS = 20;
    public static final int DEFAULT_DAYS = 30;
    public static final int MAX_DAYS = 365;

    /** 事件時間的上界多留一點，避免 now 跟寫入時間同一刻被切掉 */
    private static final Duration UPPER_SLACK = Duration.ofSeconds(1);

    private final EventStore eventStore;
    private final UserAccountService users;
    private final SupportedLanguages languages;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AnalyticsViews.DashboardView dashboard(String email) {
        UserDtos.UserInfo info = users.profile(email);

        Instant now = clock.instant();
        Instant upper = now.plus(UPPER_SLACK);
        Instant startOfToday = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<EventSlice> week = eventStore.slices(email, now.minus(Duration.ofDays(7)), upper);
        List<EventSlice> today = week.stream().filter(s -> !s.createdAt().isBefore(startOfToday)).toList();

        var recent = eventStore.recent(email, DASHBOARD_RECENT).stream()
                .map(e -> TranslationItems.from(e, languages))
                .toList();

        return new AnalyticsViews.DashboardView(
                true,
                info,
                AnalyticsCalculator.counts(today),
                AnalyticsCalculator.week(week),
                recent,
                AnalyticsCalculator.topPairsFromRollups(eventStore.rollups(email), DASHBOARD_TOP_PAIRS, languages::nameOf)
        );
    }

    /**
     * period：7 / 30 / 90 / all（滾動視窗：now - n 天）
     */
    @Transactional(readOnly = true)
    public AnalyticsViews.StatisticsView statistics(String email, String period) {
        Integer days = parsePeriod(period);
        UserDtos.UserInfo info = users.profile(email);

        Instant now = clock.instant();
        Instant from = (days == null) ? Instant.EPOCH : now.minus(Duration.ofDays(days));
        List<EventSlice> slices = eventStore.slices(email, from, now.plus(UPPER_SLACK));

        return new AnalyticsViews.StatisticsView(
                true,
                days == null ? "all" : String.valueOf(days),
                info,
                AnalyticsCalculator.overall(slices),
                AnalyticsCalculator.dailyActivity(slices),
                AnalyticsCalculator.hourly(slices),
                AnalyticsCalculator.topPairs(slices, STATISTICS_TOP_PAIRS),
                AnalyticsCalculator.performanceByType(slices)
        );
    }

    /**
     * days：預設 30，上限 365，小於 1 視為錯誤。
     * 區間是含今天在內的最近 days 個 UTC 日曆天。
     */
    @Transactional(readOnly = true)
    public AnalyticsViews.DailyAnalyticsView daily(String email, Integer daysParam) {
        int days = (daysParam == null) ? DEFAULT_DAYS : daysParam;
        if (days < 1) throw new InvalidInputException("INVALID_DAYS", "days must be at least 1");
        days = Math.min(days, MAX_DAYS);

        users.requireUser(email);

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant from = today.minusDays(days - 1L).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<EventSlice> slices = eventStore.slices(email, from, now.plus(UPPER_SLACK));

        return new AnalyticsViews.DailyAnalyticsView(
                true,
                days,
                AnalyticsCalculator.dailyRows(slices),
                AnalyticsCalculator.dailySummary(slices, today, days)
        );
    }

    /** 全部來自 rollup，不掃原始事件 */
    @Transactional(readOnly = true)
    public AnalyticsViews.LanguageAnalyticsView languages(String email) {
        users.requireUser(email);
        return AnalyticsCalculator.languages(eventStore.rollups(email), languages::nameOf);
    }

    @Transactional
    public AnalyticsViews.PairStats setFavoritePair(String email, String source, String target, Boolean favorite) {
        String src = requireLanguage(source, "INVALID_SOURCE_LANGUAGE");
        String tgt = requireLanguage(target, "INVALID_TARGET_LANGUAGE");
        boolean fav = favorite == null || favorite;

        LanguagePairRollupEntity r = eventStore.setFavoritePair(email, src, tgt, fav);
        return AnalyticsCalculator.pairStats(r, languages::nameOf);
    }

    // ===== helpers =====

    /** null = all */
    static Integer parsePeriod(String raw) {
        if (raw == null || raw.isBlank()) return 30;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "all" -> null;
            case "7", "30", "90" -> Integer.valueOf(v);
            default -> throw new InvalidInputException("INVALID_PERIOD", "period must be one of 7, 30, 90, all");
        };
    }

    private String requireLanguage(String raw, String code) {
        String c = languages.resolve(raw);
        if (c == null) throw new InvalidInputException(code, "Unsupported language: " + raw);
        return c;
    }
}
