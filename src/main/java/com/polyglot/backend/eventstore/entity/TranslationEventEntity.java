package com.polyglot.backend.eventstore.entity;

import com.polyglot.backend.eventstore.model.TranslationType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 翻譯事件：insert 之後不再修改，只會被「清除全部紀錄」刪掉。
 */
@Getter
@Setter
@Entity
@Table(name = "translations",
        indexes = {
                @Index(name = "idx_translations_user_created", columnList = "user_email,created_at"),
                @Index(name = "idx_translations_user_pair", columnList = "user_email,source_language,target_language")
        }
)
public class TranslationEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", length = 255, nullable = false, updatable = false)
    private String userEmail;

    @Column(name = "source_language", length = 16, nullable = false, updatable = false)
    private String sourceLanguage;

    @Column(name = "target_language", length = 16, nullable = false, updatable = false)
    private String targetLanguage;

    @Column(name = "original_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String originalText;

    @Column(name = "translated_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String translatedText;

    @Enumerated(EnumType.STRING)
    @Column(name = "translation_type", length = 16, nullable = false, updatable = false)
    private TranslationType translationType = TranslationType.TEXT;

    /** 原文的 code point 數 */
    @Column(name = "character_count", nullable = false, updatable = false)
    private int characterCount;

    @Column(name = "translation_time_ms", nullable = false, updatable = false)
    private long translationTimeMs;

    /** 0.0 ~ 1.0；provider 沒給就是 null */
    @Column(name = "confidence_score", updatable = false)
    private Double confidenceScore;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
