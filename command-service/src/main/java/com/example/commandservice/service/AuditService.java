package com.example.commandservice.service;

import com.example.commandservice.dto.Command;
import com.example.commandservice.dto.response.AuditRecordResponse;
import com.example.commandservice.entity.AuditLog;
import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.AuditAppendException;
import com.example.commandservice.exception.IdempotencyKeyConflictException;
import com.example.commandservice.handler.HandlerOutcome;
import com.example.commandservice.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit ledger.
 *
 * <p>{@link #append} joins the caller's transaction: for keyed commands the record is written in
 * the same transaction as the entity change, and a duplicate idempotency key aborts both.
 * Failures are never swallowed here; the router decides what a failed append means.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final String KEY_COLUMN = "idempotency_key";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRED)
    public AuditLog append(Command command, EntityKind kind, CommandAction action,
                           String intent, String requestId, HandlerOutcome outcome) {
        AuditLog record = AuditLog.builder()
                .ownerId(command.getOwnerId())
                .action(action)
                .entityKind(kind)
                .entityId(outcome.getEntityId())
                .beforeState(writeState(outcome.getBeforeState()))
                .afterState(writeState(outcome.getAfterState()))
                .source(command.getSource())
                .requestId(requestId)
                .transactionId(command.getTransactionId())
                .idempotencyKey(command.hasIdempotencyKey() ? command.getIdempotencyKey() : null)
                .intent(intent)
                .build();

        try {
            AuditLog saved = auditLogRepository.saveAndFlush(record);
            log.info("Audit record appended: id={}, ownerId={}, action={}, entityKind={}, entityId={}",
                    saved.getId(), saved.getOwnerId(), saved.getAction(), saved.getEntityKind(), saved.getEntityId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (record.getIdempotencyKey() != null && violatesIdempotencyKey(e)) {
                throw new IdempotencyKeyConflictException(record.getIdempotencyKey(), e);
            }
            throw new AuditAppendException("Failed to append audit record", e);
        } catch (ConcurrencyFailureException e) {
            // only a keyed insert waits on another transaction: the unique key index entry
            if (record.getIdempotencyKey() != null) {
                throw new IdempotencyKeyConflictException(record.getIdempotencyKey(), e);
            }
            throw new AuditAppendException("Failed to append audit record", e);
        } catch (DataAccessException e) {
            throw new AuditAppendException("Failed to append audit record", e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<AuditLog> findByIdempotencyKey(String idempotencyKey) {
        return auditLogRepository.findByIdempotencyKey(idempotencyKey);
    }

    /**
     * All records of one user intent, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditRecordResponse> findTransaction(UUID ownerId, UUID transactionId) {
        return auditLogRepository.findByOwnerIdAndTransactionIdOrderByCreatedAtAsc(ownerId, transactionId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditRecordResponse> findEntityHistory(UUID ownerId, EntityKind kind, UUID entityId) {
        return auditLogRepository
                .findByOwnerIdAndEntityKindAndEntityIdOrderByCreatedAtAsc(ownerId, kind.getWireName(), entityId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    public JsonNode readState(AuditLog record, String state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.readTree(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable state on audit record " + record.getId(), e);
        }
    }

    private AuditRecordResponse toResponse(AuditLog record) {
        return AuditRecordResponse.builder()
                .id(record.getId())
                .action(record.getAction())
                .entityKind(record.getEntityKind())
                .entityId(record.getEntityId())
                .beforeState(readState(record, record.getBeforeState()))
                .afterState(readState(record, record.getAfterState()))
                .source(record.getSource())
                .requestId(record.getRequestId())
                .transactionId(record.getTransactionId())
                .idempotencyKey(record.getIdempotencyKey())
                .intent(record.getIntent())
                .createdAt(record.getCreatedAt())
                .build();
    }

    /**
     * True only for a unique violation on the idempotency key constraint. Other integrity
     * failures (not-null, length, checks) must not be replayed as a lost race.
     */
    static boolean violatesIdempotencyKey(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && mentionsKey(violation.getConstraintName())) {
                return true;
            }
            if (cause instanceof SQLException sql
                    && UNIQUE_VIOLATION_STATE.equals(sql.getSQLState())
                    && mentionsKey(sql.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsKey(String text) {
        return text != null
                && text.toLowerCase(Locale.ROOT).contains(KEY_COLUMN);
    }

    private String writeState(JsonNode state) {
        if (state == null || state.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new AuditAppendException("Failed to serialize audit state", e);
        }
    }
}
