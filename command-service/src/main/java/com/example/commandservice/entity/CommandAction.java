package com.example.commandservice.entity;

import java.util.Locale;
import java.util.Optional;

public enum CommandAction {
    CREATE,
    READ,
    UPDATE,
    DELETE;

    public boolean isMutating() {
        return this != READ;
    }

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandAction> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CommandAction action : values()) {
            if (action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
