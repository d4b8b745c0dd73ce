package com.polyglot.backend.eventstore.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * (user, source, target) 的累計值，跟事件 insert 在同一個 transaction 更新。
 * 平均值都是讀的時候才算。
 */
@Getter
@Setter
@Entity
@Table(name = "user_language_stats",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_user_language_stats_pair",
                columnNames = {"user_email", "source_language", "target_language"}
        )
)
public class LanguagePairRollupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", length = 255, nullable = false)
    private String userEmail;

    @Column(name = "source_language", length = 16, nullable = false)
    private String sourceLanguage;

    @Column(name = "target_language", length = 16, nullable = false)
    private String targetLanguage;

    @Column(name = "usage_count", nullable = false)
    private long usageCount = 0;

    @Column(name = "total_characters", nullable = false)
    private long totalCharacters = 0;

    @Column(name = "total_time_ms", nullable = false)
    private long totalTimeMs = 0;

    @Column(name = "confidence_sum", nullable = false)
    private double confidenceSum = 0;

    /** 有 confidence 的事件數（平均信心度的分母） */
    @Column(name = "confidence_count", nullable = false)
    private long confidenceCount = 0;

    @Column(name = "first_used_at", nullable = false)
    private Instant firstUsedAt;

    @Column(name = "last_used_at", nullable = false)
    private Instant lastUsedAt;

    /** 最後使用的 UTC 日期，用來判斷 days_used 要不要 +1 */
    @Column(name = "last_used_day", nullable = false)
    private LocalDate lastUsedDay;

    @Column(name = "days_used", nullable = false)
    private int daysUsed = 0;

    @Column(name = "favorite_pair", nullable = false)
    private boolean favorite = false;

    public String pair() {
        return sourceLanguage + "-" + targetLanguage;
    }

    /**
     * 套用一筆新事件。
     * day 是事件 createdAt 的 UTC 日期；同一使用者的事件時間不會倒退，所以只需要跟 lastUsedDay 比。
     */
    public void apply(int characters, long elapsedMs, Double confidence, Instant at, LocalDate day) {
        usageCount += 1;
        totalCharacters += characters;
        totalTimeMs += elapsedMs;
        if (confidence != null) {
            confidenceSum += confidence;
            confidenceCount += 1;
        }

        if (firstUsedAt == null || at.isBefore(firstUsedAt)) firstUsedAt = at;

        if (lastUsedDay == null || day.isAfter(lastUsedDay)) {
            daysUsed += 1;
            lastUsedDay = day;
        }

        if (lastUsedAt == null || at.isAfter(lastUsedAt)) {
            lastUsedAt = at;
        }
    }
}
