package com.example.commandservice.service;

import com.example.commandservice.dto.Command;
import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.entity.AuditLog;
import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.BaseException;
import com.example.commandservice.exception.ErrorCode;
import com.example.commandservice.exception.IdempotencyKeyConflictException;
import com.example.commandservice.handler.EntityHandler;
import com.example.commandservice.handler.HandlerOutcome;
import com.example.commandservice.handler.Payload;
import com.example.commandservice.metrics.CommandMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for commands.
 *
 * <p>Order per command: validate kind and action, replay keyed duplicates, run the handler,
 * append the audit record. Reads skip the guard and the ledger.
 * <ul>
 *   <li>Keyed mutation: handler and audit append share one store transaction. Losing the race on
 *       the idempotency key rolls back the loser's entity change and replays the winner. Handlers
 *       that call a remote service run first, outside it; only their append is transactional.</li>
 *   <li>Unkeyed mutation: the entity change commits first; a failed append afterwards is logged,
 *       counted and reported as {@code degraded} on a successful envelope.</li>
 * </ul>
 * No exception escapes {@link #handle}: every failure becomes an error envelope.
 */
@Service
@Slf4j
public class CommandRouter {

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_TRANSACTION_ID = "transactionId";

    private final Map<EntityKind, EntityHandler> handlers = new EnumMap<>(EntityKind.class);
    private final IdempotencyGuard idempotencyGuard;
    private final AuditService auditService;
    private final TransactionOperations transactionOperations;
    private final CommandMetrics metrics;

    public CommandRouter(List<EntityHandler> entityHandlers,
                         IdempotencyGuard idempotencyGuard,
                         AuditService auditService,
                         TransactionOperations transactionOperations,
                         CommandMetrics metrics) {
        for (EntityHandler handler : entityHandlers) {
            EntityHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for entity kind " + handler.kind());
            }
        }
        for (EntityKind kind : EntityKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for entity kind " + kind);
            }
        }
        this.idempotencyGuard = idempotencyGuard;
        this.auditService = auditService;
        this.transactionOperations = transactionOperations;
        this.metrics = metrics;
    }

    public CommandResult handle(Command command) {
        String requestId = command.getRequestId() != null && !command.getRequestId().isBlank()
                ? command.getRequestId()
                : UUID.randomUUID().toString();
        MDC.put(MDC_REQUEST_ID, requestId);
        if (command.getTransactionId() != null) {
            MDC.put(MDC_TRANSACTION_ID, command.getTransactionId().toString());
        }
        try {
            return route(command, requestId);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRANSACTION_ID);
        }
    }

    private CommandResult route(Command command, String requestId) {
        Optional<EntityKind> kind = EntityKind.fromWire(command.getEntityKind());
        if (kind.isEmpty()) {
            log.warn("Rejected command with unknown entity kind: {}", command.getEntityKind());
            return record(null, null, CommandResult.failure(
                    ErrorCode.UNKNOWN_ENTITY, "Unknown entity kind: " + command.getEntityKind()));
        }
        Optional<CommandAction> action = CommandAction.fromWire(command.getAction());
        if (action.isEmpty()) {
            log.warn("Rejected command with unknown action: {}", command.getAction());
            return record(kind.get(), null, CommandResult.failure(
                    ErrorCode.UNKNOWN_ACTION, "Unknown action: " + command.getAction()));
        }

        EntityKind entityKind = kind.get();
        CommandAction commandAction = action.get();
        EntityHandler handler = handlers.get(entityKind);
        Payload payload = Payload.of(command.getPayload());
        String intent = command.getIntent() != null && !command.getIntent().isBlank()
                ? command.getIntent()
                : commandAction.getWireName() + "_" + entityKind.getWireName();

        log.info("Handling command: ownerId={}, intent={}, kind={}, action={}, keyed={}",
                command.getOwnerId(), intent, entityKind.getWireName(), commandAction.getWireName(),
                command.hasIdempotencyKey());

        CommandResult result;
        try {
            if (!commandAction.isMutating()) {
                HandlerOutcome outcome = handler.read(command.getOwnerId(), payload);
                result = CommandResult.ok(outcome.getData(), outcome.getEntityId());
            } else if (command.hasIdempotencyKey()) {
                result = executeKeyed(command, entityKind, commandAction, handler, payload, intent, requestId);
            } else {
                result = executeUnkeyed(command, entityKind, commandAction, handler, payload, intent, requestId);
            }
        } catch (BaseException ex) {
            log.warn("Command failed: {} - {}", ex.getErrorCode(), ex.getMessage());
            result = CommandResult.failure(ex);
        } catch (OptimisticLockingFailureException ex) {
            log.warn("Concurrent modification rejected: kind={}, message={}", entityKind, ex.getMessage());
            result = CommandResult.failure(ErrorCode.VERSION_CONFLICT,
                    "Record was modified concurrently; reload and retry");
        } catch (RuntimeException ex) {
            log.error("Handler failed: kind={}, action={}", entityKind, commandAction, ex);
            result = CommandResult.failure(ErrorCode.WORKER_ERROR, "Command execution failed");
        }
        return record(entityKind, commandAction, result);
    }

    private CommandResult executeKeyed(Command command, EntityKind kind, CommandAction action,
                                       EntityHandler handler, Payload payload,
                                       String intent, String requestId) {
        UUID ownerId = command.getOwnerId();
        String key = command.getIdempotencyKey();

        Optional<CommandResult> cached = idempotencyGuard.lookup(ownerId, key);
        if (cached.isPresent()) {
            log.info("Idempotent replay: key={}", key);
            metrics.recordReplay(kind.getWireName());
            return cached.get();
        }

        try {
            if (handler.callsExternalService()) {
                // nothing to roll back; keep the remote call off a pooled connection
                HandlerOutcome outcome = invoke(handler, action, ownerId, payload);
                AuditLog record = transactionOperations.execute(status ->
                        auditService.append(command, kind, action, intent, requestId, outcome));
                return success(outcome, record.getId());
            }
            return transactionOperations.execute(status -> {
                HandlerOutcome outcome = invoke(handler, action, ownerId, payload);
                AuditLog record = auditService.append(command, kind, action, intent, requestId, outcome);
                return success(outcome, record.getId());
            });
        } catch (IdempotencyKeyConflictException ex) {
            log.info("Lost idempotency race, replaying winner: key={}", key);
            metrics.recordReplay(kind.getWireName());
            return idempotencyGuard.awaitReplay(ownerId, key);
        } catch (OptimisticLockingFailureException ex) {
            // the winner of the same key may have bumped the version first
            Optional<CommandResult> winner = idempotencyGuard.lookup(ownerId, key);
            if (winner.isPresent()) {
                metrics.recordReplay(kind.getWireName());
                return winner.get();
            }
            throw ex;
        }
    }

    private CommandResult executeUnkeyed(Command command, EntityKind kind, CommandAction action,
                                         EntityHandler handler, Payload payload,
                                         String intent, String requestId) {
        UUID ownerId = command.getOwnerId();
        HandlerOutcome outcome = transactionOperations.execute(status -> invoke(handler, action, ownerId, payload));
        try {
            AuditLog record = transactionOperations.execute(status ->
                    auditService.append(command, kind, action, intent, requestId, outcome));
            return success(outcome, record.getId());
        } catch (RuntimeException ex) {
            log.error("Audit append failed after committed write: kind={}, action={}, entityId={}",
                    kind.getWireName(), action.getWireName(), outcome.getEntityId(), ex);
            metrics.recordAuditFailure(kind.getWireName());
            return success(outcome, null).toBuilder().degraded(true).build();
        }
    }

    private static HandlerOutcome invoke(EntityHandler handler, CommandAction action, UUID ownerId, Payload payload) {
        return switch (action) {
            case CREATE -> handler.create(ownerId, payload);
            case READ -> handler.read(ownerId, payload);
            case UPDATE -> handler.update(ownerId, payload);
            case DELETE -> handler.delete(ownerId, payload);
        };
    }

    private static CommandResult success(HandlerOutcome outcome, UUID auditLogId) {
        return CommandResult.ok(outcome.getAfterState(), outcome.getEntityId())
                .toBuilder()
                .auditLogId(auditLogId)
                .build();
    }

    private CommandResult record(EntityKind kind, CommandAction action, CommandResult result) {
        metrics.recordOutcome(
                kind != null ? kind.getWireName() : null,
                action != null ? action.getWireName() : null,
                result);
        return result;
    }
}
