package com.example.commandservice.entity;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of entity kinds a command can target.
 * The deletion policy is fixed per kind and never decided by a handler.
 */
@Getter
public enum EntityKind {

    EVENT("event", DeletionPolicy.LOGICAL),
    ASSIGNMENT("assignment", DeletionPolicy.PHYSICAL),
    EXAM("exam", DeletionPolicy.PHYSICAL),
    STUDY_SESSION("study_session", DeletionPolicy.PHYSICAL),
    COURSE("course", DeletionPolicy.LOGICAL),
    DOCUMENT_GENERATION("document_generation", DeletionPolicy.UNSUPPORTED);

    private static final String LEGACY_NOTES_ALIAS = "cornell_notes";

    private final String wireName;
    private final DeletionPolicy deletionPolicy;

    EntityKind(String wireName, DeletionPolicy deletionPolicy) {
        this.wireName = wireName;
        this.deletionPolicy = deletionPolicy;
    }

    /**
     * Resolve a caller-supplied kind. Accepts the snake_case wire name
     * ("study_session") and the type name in any case ("StudySession").
     */
    public static Optional<EntityKind> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (LEGACY_NOTES_ALIAS.equals(normalized)) {
            return Optional.of(DOCUMENT_GENERATION);
        }
        String compact = normalized.replace("_", "");
        for (EntityKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.wireName.replace("_", "").equals(compact)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
