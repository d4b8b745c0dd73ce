package com.polyglot.backend.analytics.dto;

import com.polyglot.backend.eventstore.model.TranslationType;
import com.polyglot.backend.history.dto.HistoryDtos;
import com.polyglot.backend.users.dto.UserDtos;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 各報表的固定輸出格式。日期/小時一律是 UTC。
 */
public class AnalyticsViews {

    // ===== dashboard =====

    public record DashboardView(
            boolean success,
            UserDtos.UserInfo userInfo,
            Counts today,
            WeekCounts thisWeek,
            List<HistoryDtos.TranslationItem> recentTranslations,
            List<PairUsage> topLanguagePairs
    ) {}

    public record Counts(long translations, long characters) {}

    public record WeekCounts(long translations, long characters, int activeDays) {}

    public record PairUsage(
            String languagePair,
            String sourceLanguage,
            String targetLanguage,
            String sourceLanguageName,
            String targetLanguageName,
            long usageCount,
            double avgCharacters,
            double avgTimeMs,
            double avgConfidence,
            Instant lastUsed,
            boolean favorite
    ) {}

    // ===== statistics =====

    public record StatisticsView(
            boolean success,
            String period,
            UserDtos.UserInfo userInfo,
            Overall overallStatistics,
            List<DailyActivity> dailyActivity,
            List<HourBucket> hourlyPatterns,
            List<TopPair> topLanguagePairs,
            List<TypePerformance> performanceByType
    ) {}

    public record Overall(
            long totalTranslations,
            long totalCharacters,
            double avgCharactersPerTranslation,
            double avgTranslationTimeMs,
            int uniqueSourceLanguages,
            int uniqueTargetLanguages,
            int activeDays,
            Instant firstTranslation,
            Instant lastTranslation
    ) {}

    public record DailyActivity(
            LocalDate date,
            long translations,
            long characters,
            double avgTimeMs,
            int languagePairs
    ) {}

    public record HourBucket(int hour, long translations, long characters) {}

    public record TopPair(
            String languagePair,
            String sourceLanguage,
            String targetLanguage,
            long count,
            long totalCharacters,
            double avgCharacters,
            double avgConfidence,
            Instant lastUsed
    ) {}

    public record TypePerformance(
            TranslationType translationType,
            long count,
            double avgTimeMs,
            double avgCharacters,
            double avgConfidence
    ) {}

    // ===== daily analytics =====

    public record DailyAnalyticsView(
            boolean success,
            int periodDays,
            List<DailyRow> dailyData,
            DailySummary summary
    ) {}

    public record DailyRow(
            LocalDate date,
            long translations,
            long characters,
            double avgCharacters,
            double avgTimeMs,
            int languagePairs,
            int sourceLanguagesUsed,
            int targetLanguagesUsed,
            int activeHours,
            LocalTime firstTranslationTime,
            LocalTime lastTranslationTime
    ) {}

    public record DailySummary(
            int totalDays,
            int activeDays,
            long totalTranslations,
            long totalCharacters,
            double avgTranslationsPerDay,
            double trendPercentage
    ) {}

    // ===== language analytics =====

    public record LanguageAnalyticsView(
            boolean success,
            List<LanguageUsage> sourceLanguages,
            List<LanguageUsage> targetLanguages,
            List<PairStats> languagePairs,
            LanguageSummary summary
    ) {}

    public record LanguageUsage(
            String language,
            String languageName,
            long usageCount,
            long totalCharacters,
            double avgCharacters,
            double avgTimeMs,
            Instant lastUsed
    ) {}

    public record PairStats(
            String languagePair,
            String sourceLanguage,
            String targetLanguage,
            String sourceLanguageName,
            String targetLanguageName,
            long usageCount,
            long totalCharacters,
            double avgCharacters,
            double avgTimeMs,
            double avgConfidence,
            Instant firstUsed,
            Instant lastUsed,
            int daysUsed,
            boolean favorite
    ) {}

    /** 沒有任何紀錄時 mostUsed* 是 null */
    public record LanguageSummary(
            int uniqueSourceLanguages,
            int uniqueTargetLanguages,
            int uniquePairs,
            String mostUsedSource,
            String mostUsedTarget,
            String mostUsedPair
    ) {}

    // ===== favorite pair =====

    public record FavoritePairRequest(
            String sourceLanguage,
            String targetLanguage,
            Boolean favorite
    ) {}

    public record FavoritePairResponse(boolean success, PairStats pair) {}
}
