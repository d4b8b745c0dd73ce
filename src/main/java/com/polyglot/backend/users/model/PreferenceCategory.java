package com.polyglot.backend.users.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PreferenceCategory {
    UI,
    TRANSLATION,
    AUDIO,
    GENERAL,
    PRIVACY;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 沒帶 → GENERAL；不認得 → null */
    public static PreferenceCategory fromWireOrDefault(String raw) {
        if (raw == null || raw.isBlank()) return GENERAL;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (PreferenceCategory c : values()) {
            if (c.name().equals(v)) return c;
        }
        return null;
    }
}
