package com.polyglot.backend.users.entity;

import com.polyglot.backend.users.model.PreferenceCategory;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 使用者的 key/value 偏好；value 存 JSON 字串。
 * (user_email, preference_key) 唯一。
 */
@Getter
@Setter
@Entity
@Table(name = "user_preferences",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_user_preferences_key",
                columnNames = {"user_email", "preference_key"}
        ),
        indexes = @Index(name = "idx_user_preferences_category", columnList = "user_email, category")
)
public class UserPreferenceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", length = 255, nullable = false, updatable = false)
    private String userEmail;

    @Column(name = "preference_key", length = 100, nullable = false, updatable = false)
    private String preferenceKey;

    @Column(name = "preference_value", columnDefinition = "TEXT", nullable = false)
    private String preferenceValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 16, nullable = false)
    private PreferenceCategory category = PreferenceCategory.GENERAL;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
