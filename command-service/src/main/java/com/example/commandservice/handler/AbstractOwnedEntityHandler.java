package com.example.commandservice.handler;

import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.DeletionPolicy;
import com.example.commandservice.entity.OwnedEntity;
import com.example.commandservice.entity.SoftDeletable;
import com.example.commandservice.exception.NotImplementedException;
import com.example.commandservice.exception.ResourceNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared CRUD flow for handlers backed by an owner-scoped JPA entity.
 *
 * <p>update and delete pre-fetch by (id, owner) and fail with NOT_FOUND before touching anything.
 * Writes are flushed immediately so constraint and version failures surface inside the handler call.
 * The delete style comes from the kind's {@link DeletionPolicy}.
 */
@Slf4j
public abstract class AbstractOwnedEntityHandler<E extends OwnedEntity> implements EntityHandler {

    protected final ObjectMapper objectMapper;

    protected AbstractOwnedEntityHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract JpaRepository<E, UUID> repository();

    protected abstract Optional<E> findOwned(UUID ownerId, UUID id);

    /**
     * Build a new, unsaved entity from a create payload. Validates required fields and references.
     */
    protected abstract E newEntity(UUID ownerId, Payload payload);

    /**
     * Apply the fields present in {@code payload} to a managed entity.
     */
    protected abstract void applyUpdate(UUID ownerId, E entity, Payload payload);

    protected abstract List<E> list(UUID ownerId, Payload filter);

    @Override
    public HandlerOutcome create(UUID ownerId, Payload payload) {
        E saved = repository().saveAndFlush(newEntity(ownerId, payload));
        log.info("Created {}: ownerId={}, id={}", kind().getWireName(), ownerId, saved.getId());
        return HandlerOutcome.mutation(saved.getId(), null, snapshot(saved));
    }

    @Override
    public HandlerOutcome read(UUID ownerId, Payload filter) {
        if (filter.has("id")) {
            UUID id = filter.requiredUuid("id");
            return HandlerOutcome.read(snapshot(require(ownerId, id)), id);
        }
        List<E> rows = list(ownerId, filter);
        ArrayNode array = objectMapper.createArrayNode();
        rows.forEach(row -> array.add(snapshot(row)));
        log.debug("Listed {} {} records: ownerId={}", rows.size(), kind().getWireName(), ownerId);
        return HandlerOutcome.read(array, null);
    }

    @Override
    public HandlerOutcome update(UUID ownerId, Payload payload) {
        UUID id = payload.requiredUuid("id");
        E entity = require(ownerId, id);
        JsonNode before = snapshot(entity);

        applyUpdate(ownerId, entity, payload);
        E saved = repository().saveAndFlush(entity);

        log.info("Updated {}: ownerId={}, id={}", kind().getWireName(), ownerId, id);
        return HandlerOutcome.mutation(id, before, snapshot(saved));
    }

    @Override
    public HandlerOutcome delete(UUID ownerId, Payload payload) {
        UUID id = payload.requiredUuid("id");
        E entity = require(ownerId, id);
        JsonNode before = snapshot(entity);

        DeletionPolicy policy = kind().getDeletionPolicy();
        switch (policy) {
            case LOGICAL -> {
                ((SoftDeletable) entity).deactivate();
                E saved = repository().saveAndFlush(entity);
                log.info("Deactivated {}: ownerId={}, id={}", kind().getWireName(), ownerId, id);
                return HandlerOutcome.mutation(id, before, snapshot(saved));
            }
            case PHYSICAL -> {
                repository().delete(entity);
                repository().flush();
                log.info("Deleted {}: ownerId={}, id={}", kind().getWireName(), ownerId, id);
                return HandlerOutcome.mutation(id, before, null);
            }
            default -> throw new NotImplementedException(kind(), CommandAction.DELETE);
        }
    }

    protected E require(UUID ownerId, UUID id) {
        return findOwned(ownerId, id)
                .orElseThrow(() -> ResourceNotFoundException.entityNotFound(kind(), id));
    }

    /**
     * JSON view of the entity as it will read back from the audit ledger.
     */
    protected JsonNode snapshot(E entity) {
        try {
            return objectMapper.readTree(objectMapper.writeValueAsString(entity));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + kind().getWireName() + " " + entity.getId(), e);
        }
    }
}
