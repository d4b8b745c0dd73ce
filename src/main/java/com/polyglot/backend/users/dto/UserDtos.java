package com.polyglot.backend.users.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.polyglot.backend.users.model.PreferenceCategory;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

public class UserDtos {

    /** 使用者基本資料（dashboard / statistics 也會帶這一份） */
    public record UserInfo(
            String email,
            String fullName,
            String preferredSourceLang,
            String preferredTargetLang,
            long totalTranslations,
            long totalCharacters,
            Instant memberSince,
            Instant lastLogin
    ) {}

    public record ProfileResponse(
            boolean success,
            UserInfo user
    ) {}

    /** POST /api/v1/users/login：fullName 可省略 */
    public record LoginRequest(
            @Size(max = 255) String fullName
    ) {}

    /** PATCH /api/v1/users/me/preferences：只改有帶的欄位 */
    public record PreferencesRequest(
            String preferredSourceLang,
            String preferredTargetLang
    ) {}

    // ===== key/value 偏好 =====

    /** PUT /api/v1/users/me/preferences/{key}：value 是任意 JSON；category 省略時為 general */
    public record PreferenceValueRequest(
            JsonNode value,
            String category
    ) {}

    public record PreferenceItem(
            String key,
            PreferenceCategory category,
            JsonNode value,
            Instant updatedAt
    ) {}

    public record PreferenceResponse(
            boolean success,
            PreferenceItem preference
    ) {}

    /** category → (key → value) */
    public record AllPreferencesResponse(
            boolean success,
            Map<String, Map<String, JsonNode>> preferences
    ) {}
}
