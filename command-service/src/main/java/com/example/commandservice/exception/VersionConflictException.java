package com.example.commandservice.exception;

import java.util.UUID;

/**
 * Stale write against a versioned record (HTTP 409).
 */
public class VersionConflictException extends BaseException {

    public VersionConflictException(String message) {
        super(ErrorCode.VERSION_CONFLICT, message);
    }

    public static VersionConflictException staleVersion(UUID id, Integer expected, Integer actual) {
        return new VersionConflictException(String.format(
                "Record %s was modified concurrently: expected version %s, current version %s",
                id, expected, actual));
    }
}
