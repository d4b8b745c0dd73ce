package com.polyglot.backend.analytics.service;

import com.polyglot.backend.analytics.dto.AnalyticsViews;
import com.polyglot.backend.eventstore.entity.LanguagePairRollupEntity;
import com.polyglot.backend.eventstore.model.EventSlice;
import com.polyglot.backend.eventstore.model.TranslationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 報表計算（純函式）：輸入是事件投影或 rollup，輸出是 view record。
 * - 日期 / 小時一律用 UTC
 * - 平均值分母為 0 時回 0
 * - 平均值四捨五入到小數 2 位（信心度 3 位）
 */
public final class AnalyticsCalculator {

    private AnalyticsCalculator() {}

    public static final int HOURS_PER_DAY = 24;

    /** 次數多的在前；同次數最近用過的在前；再同就比 pair 字串 */
    private static final Comparator<AnalyticsViews.TopPair> TOP_PAIR_ORDER =
            Comparator.comparingLong(AnalyticsViews.TopPair::count).reversed()
                    .thenComparing(AnalyticsViews.TopPair::lastUsed, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(AnalyticsViews.TopPair::languagePair);

    private static final Comparator<LanguagePairRollupEntity> ROLLUP_ORDER =
            Comparator.comparingLong(LanguagePairRollupEntity::getUsageCount).reversed()
                    .thenComparing(LanguagePairRollupEntity::getLastUsedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(LanguagePairRollupEntity::pair);

    // ===== dashboard =====

    public static AnalyticsViews.Counts counts(List<EventSlice> slices) {
        long chars = 0;
        for (EventSlice s : slices) chars += s.characterCount();
        return new AnalyticsViews.Counts(slices.size(), chars);
    }

    public static AnalyticsViews.WeekCounts week(List<EventSlice> slices) {
        long chars = 0;
        Set<LocalDate> days = new HashSet<>();
        for (EventSlice s : slices) {
            chars += s.characterCount();
            days.add(utcDate(s.createdAt()));
        }
        return new AnalyticsViews.WeekCounts(slices.size(), chars, days.size());
    }

    public static List<AnalyticsViews.PairUsage> topPairsFromRollups(List<LanguagePairRollupEntity> rollups,
                                                                     int limit,
                                                                     Function<String, String> nameOf) {
        return rollups.stream()
                .sorted(ROLLUP_ORDER)
                .limit(Math.max(0, limit))
                .map(r -> new AnalyticsViews.PairUsage(
                        r.pair(),
                        r.getSourceLanguage(),
                        r.getTargetLanguage(),
                        nameOf.apply(r.getSourceLanguage()),
                        nameOf.apply(r.getTargetLanguage()),
                        r.getUsageCount(),
                        avg(r.getTotalCharacters(), r.getUsageCount()),
                        avg(r.getTotalTimeMs(), r.getUsageCount()),
                        avgConfidence(r.getConfidenceSum(), r.getConfidenceCount()),
                        r.getLastUsedAt(),
                        r.isFavorite()
                ))
                .toList();
    }

    // ===== statistics =====

    public static AnalyticsViews.Overall overall(List<EventSlice> slices) {
        long chars = 0;
        long time = 0;
        Set<String> sources = new HashSet<>();
        Set<String> targets = new HashSet<>();
        Set<LocalDate> days = new HashSet<>();
        Instant first = null;
        Instant last = null;

        for (EventSlice s : slices) {
            chars += s.characterCount();
            time += s.elapsedMs();
            sources.add(s.sourceLanguage());
            targets.add(s.targetLanguage());
            days.add(utcDate(s.createdAt()));
            if (first == null || s.createdAt().isBefore(first)) first = s.createdAt();
            if (last == null || s.createdAt().isAfter(last)) last = s.createdAt();
        }

        return new AnalyticsViews.Overall(
                slices.size(),
                chars,
                avg(chars, slices.size()),
                avg(time, slices.size()),
                sources.size(),
                targets.size(),
                days.size(),
                first,
                last
        );
    }

    /** 一天一列，新到舊；沒有活動的日子不出現 */
    public static List<AnalyticsViews.DailyActivity> dailyActivity(List<EventSlice> slices) {
        List<AnalyticsViews.DailyActivity> out = new ArrayList<>();
        byDayNewestFirst(slices).forEach((day, list) -> {
            long chars = 0;
            long time = 0;
            Set<String> pairs = new HashSet<>();
            for (EventSlice s : list) {
                chars += s.characterCount();
                time += s.elapsedMs();
                pairs.add(s.pair());
            }
            out.add(new AnalyticsViews.DailyActivity(day, list.size(), chars, avg(time, list.size()), pairs.size()));
        });
        return out;
    }

    /** 固定 24 格（0..23），沒資料的小時是 0 */
    public static List<AnalyticsViews.HourBucket> hourly(List<EventSlice> slices) {
        long[] count = new long[HOURS_PER_DAY];
        long[] chars = new long[HOURS_PER_DAY];
        for (EventSlice s : slices) {
            int h = s.createdAt().atZone(ZoneOffset.UTC).getHour();
            count[h]++;
            chars[h] += s.characterCount();
        }
        List<AnalyticsViews.HourBucket> out = new ArrayList<>(HOURS_PER_DAY);
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            out.add(new AnalyticsViews.HourBucket(h, count[h], chars[h]));
        }
        return out;
    }

    public static List<AnalyticsViews.TopPair> topPairs(List<EventSlice> slices, int limit) {
        Map<String, PairAcc> acc = new HashMap<>();
        for (EventSlice s : slices) {
            acc.computeIfAbsent(s.pair(), k -> new PairAcc(s.sourceLanguage(), s.targetLanguage())).add(s);
        }
        return acc.entrySet().stream()
                .map(e -> e.getValue().toTopPair(e.getKey()))
                .sorted(TOP_PAIR_ORDER)
                .limit(Math.max(0, limit))
                .toList();
    }

    /** 每種 translation_type 一列（沒有資料的 type 不出現） */
    public static List<AnalyticsViews.TypePerformance> performanceByType(List<EventSlice> slices) {
        Map<TranslationType, List<EventSlice>> byType = new EnumMap<>(TranslationType.class);
        for (EventSlice s : slices) {
            TranslationType t = s.translationType() == null ? TranslationType.TEXT : s.translationType();
            byType.computeIfAbsent(t, k -> new ArrayList<>()).add(s);
        }

        List<AnalyticsViews.TypePerformance> out = new ArrayList<>();
        byType.forEach((type, list) -> {
            long chars = 0;
            long time = 0;
            double confSum = 0;
            long confN = 0;
            for (EventSlice s : list) {
                chars += s.characterCount();
                time += s.elapsedMs();
                if (s.confidence() != null) {
                    confSum += s.confidence();
                    confN++;
                }
            }
            out.add(new AnalyticsViews.TypePerformance(
                    type, list.size(), avg(time, list.size()), avg(chars, list.size()), avgConfidence(confSum, confN)));
        });
        return out;
    }

    // ===== daily analytics =====

    public static List<AnalyticsViews.DailyRow> dailyRows(List<EventSlice> slices) {
        List<AnalyticsViews.DailyRow> out = new ArrayList<>();
        byDayNewestFirst(slices).forEach((day, list) -> {
            long chars = 0;
            long time = 0;
            Set<String> sources = new HashSet<>();
            Set<String> targets = new HashSet<>();
            Set<String> pairs = new HashSet<>();
            Set<Integer> hours = new HashSet<>();
            Instant first = null;
            Instant last = null;
            for (EventSlice s : list) {
                chars += s.characterCount();
                time += s.elapsedMs();
                sources.add(s.sourceLanguage());
                targets.add(s.targetLanguage());
                pairs.add(s.pair());
                ZonedDateTime at = s.createdAt().atZone(ZoneOffset.UTC);
                hours.add(at.getHour());
                if (first == null || s.createdAt().isBefore(first)) first = s.createdAt();
                if (last == null || s.createdAt().isAfter(last)) last = s.createdAt();
            }
            out.add(new AnalyticsViews.DailyRow(
                    day,
                    list.size(),
                    chars,
                    avg(chars, list.size()),
                    avg(time, list.size()),
                    pairs.size(),
                    sources.size(),
                    targets.size(),
                    hours.size(),
                    timeOfDay(first),
                    timeOfDay(last)
            ));
        });
        return out;
    }

    /**
     * 最近 days/2 個日曆天（含今天）vs 再往前同樣天數的翻譯次數變化（%）。
     * 前一段為 0 時回 0。
     */
    public static double trendPercentage(List<EventSlice> slices, LocalDate today, int days) {
        int half = days / 2;
        if (half <= 0) return 0;

        LocalDate recentStart = today.minusDays(half - 1L);
        LocalDate priorStart = today.minusDays(2L * half - 1);

        long recent = 0;
        long prior = 0;
        for (EventSlice s : slices) {
            LocalDate d = utcDate(s.createdAt());
            if (d.isAfter(today) || d.isBefore(priorStart)) continue;
            if (d.isBefore(recentStart)) prior++;
            else recent++;
        }

        if (prior == 0) return 0;
        return BigDecimal.valueOf((recent - prior) * 100L)
                .divide(BigDecimal.valueOf(prior), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static AnalyticsViews.DailySummary dailySummary(List<EventSlice> slices, LocalDate today, int days) {
        long chars = 0;
        Set<LocalDate> active = new HashSet<>();
        for (EventSlice s : slices) {
            chars += s.characterCount();
            active.add(utcDate(s.createdAt()));
        }
        return new AnalyticsViews.DailySummary(
                days,
                active.size(),
                slices.size(),
                chars,
                avg(slices.size(), days),
                trendPercentage(slices, today, days)
        );
    }

    // ===== language analytics =====

    public static AnalyticsViews.LanguageAnalyticsView languages(List<LanguagePairRollupEntity> rollups,
                                                                 Function<String, String> nameOf) {
        List<AnalyticsViews.LanguageUsage> sources =
                usageBy(rollups, LanguagePairRollupEntity::getSourceLanguage, nameOf);
        List<AnalyticsViews.LanguageUsage> targets =
                usageBy(rollups, LanguagePairRollupEntity::getTargetLanguage, nameOf);

        List<AnalyticsViews.PairStats> pairs = rollups.stream()
                .sorted(ROLLUP_ORDER)
                .map(r -> pairStats(r, nameOf))
                .toList();

        // 最多次的；同次數取字典序較小的
        String mostUsedPair = rollups.stream()
                .min(Comparator.comparingLong(LanguagePairRollupEntity::getUsageCount).reversed()
                        .thenComparing(LanguagePairRollupEntity::pair))
                .map(LanguagePairRollupEntity::pair)
                .orElse(null);

        var summary = new AnalyticsViews.LanguageSummary(
                sources.size(),
                targets.size(),
                pairs.size(),
                mostUsed(sources),
                mostUsed(targets),
                mostUsedPair
        );

        return new AnalyticsViews.LanguageAnalyticsView(true, sources, targets, pairs, summary);
    }

    public static AnalyticsViews.PairStats pairStats(LanguagePairRollupEntity r, Function<String, String> nameOf) {
        return new AnalyticsViews.PairStats(
                r.pair(),
                r.getSourceLanguage(),
                r.getTargetLanguage(),
                nameOf.apply(r.getSourceLanguage()),
                nameOf.apply(r.getTargetLanguage()),
                r.getUsageCount(),
                r.getTotalCharacters(),
                avg(r.getTotalCharacters(), r.getUsageCount()),
                avg(r.getTotalTimeMs(), r.getUsageCount()),
                avgConfidence(r.getConfidenceSum(), r.getConfidenceCount()),
                r.getFirstUsedAt(),
                r.getLastUsedAt(),
                r.getDaysUsed(),
                r.isFavorite()
        );
    }

    // ===== helpers =====

    private static List<AnalyticsViews.LanguageUsage> usageBy(List<LanguagePairRollupEntity> rollups,
                                                              Function<LanguagePairRollupEntity, String> key,
                                                              Function<String, String> nameOf) {
        Map<String, long[]> sums = new HashMap<>();   // usage, chars, time
        Map<String, Instant> lastUsed = new HashMap<>();
        for (LanguagePairRollupEntity r : rollups) {
            String k = key.apply(r);
            long[] a = sums.computeIfAbsent(k, x -> new long[3]);
            a[0] += r.getUsageCount();
            a[1] += r.getTotalCharacters();
            a[2] += r.getTotalTimeMs();
            lastUsed.merge(k, r.getLastUsedAt(), (x, y) -> x.isAfter(y) ? x : y);
        }

        return sums.entrySet().stream()
                .map(e -> {
                    long[] a = e.getValue();
                    return new AnalyticsViews.LanguageUsage(
                            e.getKey(),
                            nameOf.apply(e.getKey()),
                            a[0],
                            a[1],
                            avg(a[1], a[0]),
                            avg(a[2], a[0]),
                            lastUsed.get(e.getKey())
                    );
                })
                .sorted(Comparator.comparingLong(AnalyticsViews.LanguageUsage::usageCount).reversed()
                        .thenComparing(AnalyticsViews.LanguageUsage::language))
                .toList();
    }

    /** 已經依 (usage desc, code asc) 排好，第一個就是答案 */
    private static String mostUsed(List<AnalyticsViews.LanguageUsage> sorted) {
        return sorted.isEmpty() ? null : sorted.get(0).language();
    }

    private static TreeMap<LocalDate, List<EventSlice>> byDayNewestFirst(List<EventSlice> slices) {
        TreeMap<LocalDate, List<EventSlice>> byDay = new TreeMap<>(Comparator.reverseOrder());
        for (EventSlice s : slices) {
            byDay.computeIfAbsent(utcDate(s.createdAt()), k -> new ArrayList<>()).add(s);
        }
        return byDay;
    }

    static LocalDate utcDate(Instant at) {
        return LocalDate.ofInstant(at, ZoneOffset.UTC);
    }

    private static LocalTime timeOfDay(Instant at) {
        return at == null ? null : LocalTime.ofInstant(at, ZoneOffset.UTC).withNano(0);
    }

    static double avg(double sum, long n) {
        if (n <= 0) return 0;
        return round(sum / n, 2);
    }

    static double avgConfidence(double sum, long n) {
        if (n <= 0) return 0;
        return round(sum / n, 3);
    }

    private static double round(double v, int scale) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return 0;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class PairAcc {
        final String source;
        final String target;
        long count;
        long chars;
        double confSum;
        long confN;
        Instant lastUsed;

        PairAcc(String source, String target) {
            this.source = source;
            this.target = target;
        }

        void add(EventSlice s) {
            count++;
            chars += s.characterCount();
            if (s.confidence() != null) {
                confSum += s.confidence();
                confN++;
            }
            if (lastUsed == null || s.createdAt().isAfter(lastUsed)) lastUsed = s.createdAt();
        }

        AnalyticsViews.TopPair toTopPair(String pair) {
            return new AnalyticsViews.TopPair(
                    pair, source, target, count, chars, avg(chars, count), avgConfidence(confSum, confN), lastUsed);
        }
    }
}
