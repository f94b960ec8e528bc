package com.example.commandservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a mutating command, stored on every audit record.
 */
public enum AuditSource {
    MANUAL("manual"),
    ASSISTANT("ada-ai"),
    IMPORT("import"),
    SYNC("sync"),
    API("api");

    private final String wireName;

    AuditSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AuditSource fromWire(String value) {
        if (value == null || value.isBlank()) {
            return API;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AuditSource source : values()) {
            if (source.wireName.equals(normalized) || source.name().equalsIgnoreCase(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown audit source: " + value);
    }
}
