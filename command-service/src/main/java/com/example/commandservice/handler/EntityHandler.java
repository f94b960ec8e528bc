package com.example.commandservice.handler;

import com.example.commandservice.entity.EntityKind;

import java.util.UUID;

/**
 * Per-kind CRUD worker. Every operation is scoped to {@code ownerId}; records of other owners
 * behave as if they did not exist. update and delete take the target id from {@code payload.id}.
 */
public interface EntityHandler {

    EntityKind kind();

    HandlerOutcome create(UUID ownerId, Payload payload);

    /**
     * With {@code filter.id}: the single record or NOT_FOUND. Without: an owner-scoped list.
     */
    HandlerOutcome read(UUID ownerId, Payload filter);

    HandlerOutcome update(UUID ownerId, Payload payload);

    HandlerOutcome delete(UUID ownerId, Payload payload);

    /**
     * True when mutations call a remote service instead of the store. The router then runs them
     * outside any store transaction and records the audit entry afterwards.
     */
    default boolean callsExternalService() {
        return false;
    }
}
