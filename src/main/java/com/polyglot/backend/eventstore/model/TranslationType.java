package com.polyglot.backend.eventstore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TranslationType {
    TEXT,
    SPEECH;

    /** 對外一律小寫：text / speech */
    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 不認得回 null，由呼叫端決定錯誤碼 */
    public static TranslationType fromWireOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (TranslationType t : values()) {
            if (t.name().equals(v)) return t;
        }
        return null;
    }
}
