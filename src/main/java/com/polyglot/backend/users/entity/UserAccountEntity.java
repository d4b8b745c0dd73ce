package com.polyglot.backend.users.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "users")
public class UserAccountEntity {

    @Id
    @Column(name = "email", length = 255, nullable = false)
    private String email;

    @Column(name = "full_name", length = 255)
    private String fullName;

    @Column(name = "preferred_source_lang", length = 16, nullable = false)
    private String preferredSourceLang = "en";

    @Column(name = "preferred_target_lang", length = 16, nullable = false)
    private String preferredTargetLang = "es";

    /** 只會被 EventStore 在同一個 transaction 內異動 */
    @Column(name = "total_translations", nullable = false)
    private long totalTranslations = 0;

    @Column(name = "total_characters", nullable = false)
    private long totalCharacters = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    public void addTranslation(int characters, Instant now) {
        this.totalTranslations += 1;
        this.totalCharacters += characters;
        this.updatedAt = now;
    }

    public void resetCounters(Instant now) {
        this.totalTranslations = 0;
        this.totalCharacters = 0;
        this.updatedAt = now;
    }
}
