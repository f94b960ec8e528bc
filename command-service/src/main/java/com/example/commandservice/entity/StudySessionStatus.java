package com.example.commandservice.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum StudySessionStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<StudySessionStatus> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (StudySessionStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
