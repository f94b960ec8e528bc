package com.example.commandservice.service;

import com.example.commandservice.dto.Command;
import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.entity.AuditLog;
import com.example.commandservice.entity.AuditSource;
import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.AuditAppendException;
import com.example.commandservice.exception.ErrorCode;
import com.example.commandservice.exception.IdempotencyKeyConflictException;
import com.example.commandservice.exception.ResourceNotFoundException;
import com.example.commandservice.handler.EntityHandler;
import com.example.commandservice.handler.HandlerOutcome;
import com.example.commandservice.handler.Payload;
import com.example.commandservice.metrics.CommandMetrics;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandRouterTest {

    private static final UUID OWNER_ID = UUID.randomUUID();
    private static final String KEY = "assistant-turn-42";

    @Mock
    private IdempotencyGuard idempotencyGuard;

    @Mock
    private AuditService auditService;

    private final Map<EntityKind, EntityHandler> handlers = new EnumMap<>(EntityKind.class);
    private SimpleMeterRegistry meterRegistry;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        List<EntityHandler> all = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            EntityHandler handler = mock(EntityHandler.class);
            when(handler.kind()).thenReturn(kind);
            handlers.put(kind, handler);
            all.add(handler);
        }
        meterRegistry = new SimpleMeterRegistry();
        router = new CommandRouter(all, idempotencyGuard, auditService,
                TransactionOperations.withoutTransaction(), new CommandMetrics(meterRegistry));
    }

    private EntityHandler assignments() {
        return handlers.get(EntityKind.ASSIGNMENT);
    }

    private static Command.CommandBuilder command(String kind, String action) {
        return Command.builder()
                .ownerId(OWNER_ID)
                .entityKind(kind)
                .action(action)
                .payload(JsonNodeFactory.instance.objectNode().put("title", "Essay"))
                .source(AuditSource.API);
    }

    private static HandlerOutcome created(UUID id) {
        ObjectNode after = JsonNodeFactory.instance.objectNode().put("id", id.toString()).put("title", "Essay");
        return HandlerOutcome.mutation(id, null, after);
    }

    private static AuditLog auditRecord(UUID id) {
        AuditLog record = mock(AuditLog.class);
        when(record.getId()).thenReturn(id);
        return record;
    }

    @Test
    void unknownEntityKindFailsBeforeTouchingGuardOrLedger() {
        CommandResult result = router.handle(command("spaceship", "create").idempotencyKey(KEY).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_ENTITY);
        verifyNoInteractions(idempotencyGuard, auditService);
    }

    @Test
    void unknownActionFailsBeforeTouchingGuardOrLedger() {
        CommandResult result = router.handle(command("assignment", "archive").build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_ACTION);
        verifyNoInteractions(idempotencyGuard, auditService);
        verify(assignments(), never()).create(any(), any());
    }

    @Test
    void readBypassesGuardAndLedger() {
        UUID id = UUID.randomUUID();
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("id", id.toString());
        when(assignments().read(eq(OWNER_ID), any(Payload.class))).thenReturn(HandlerOutcome.read(data, id));

        CommandResult result = router.handle(command("assignment", "read").idempotencyKey(KEY).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo(data);
        assertThat(result.getAuditLogId()).isNull();
        verifyNoInteractions(idempotencyGuard, auditService);
    }

    @Test
    void successfulMutationCarriesAfterStateAndAuditId() {
        UUID id = UUID.randomUUID();
        UUID auditId = UUID.randomUUID();
        HandlerOutcome outcome = created(id);
        when(assignments().create(eq(OWNER_ID), any(Payload.class))).thenReturn(outcome);
        AuditLog record = auditRecord(auditId);
        when(auditService.append(any(Command.class), eq(EntityKind.ASSIGNMENT), eq(CommandAction.CREATE),
                anyString(), anyString(), eq(outcome))).thenReturn(record);

        CommandResult result = router.handle(command("assignment", "create").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntityId()).isEqualTo(id);
        assertThat(result.getData()).isEqualTo(outcome.getAfterState());
        assertThat(result.getAuditLogId()).isEqualTo(auditId);
        assertThat(result.getDegraded()).isNull();
    }

    @Test
    void missingIntentDefaultsToActionAndKind() {
        HandlerOutcome outcome = created(UUID.randomUUID());
        when(assignments().create(eq(OWNER_ID), any(Payload.class))).thenReturn(outcome);
        AuditLog record = auditRecord(UUID.randomUUID());
        ArgumentCaptor<String> intent = ArgumentCaptor.forClass(String.class);
        when(auditService.append(any(Command.class), any(), any(), intent.capture(), anyString(), any()))
                .thenReturn(record);

        router.handle(command("Assignment", "CREATE").build());

        assertThat(intent.getValue()).isEqualTo("create_assignment");
    }

    @Test
    void keyedDuplicateIsReplayedWithoutRunningHandler() {
        CommandResult cached = CommandResult.ok(JsonNodeFactory.instance.objectNode(), UUID.randomUUID())
                .toBuilder().cached(true).build();
        when(idempotencyGuard.lookup(OWNER_ID, KEY)).thenReturn(Optional.of(cached));

        CommandResult result = router.handle(command("assignment", "create").idempotencyKey(KEY).build());

        assertThat(result).isSameAs(cached);
        verify(assignments(), never()).create(any(), any());
        verifyNoInteractions(auditService);
        assertThat(meterRegistry.get("planner_command_replays_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void lostKeyRaceReplaysWinner() {
        HandlerOutcome outcome = created(UUID.randomUUID());
        when(idempotencyGuard.lookup(OWNER_ID, KEY)).thenReturn(Optional.empty());
        when(assignments().create(eq(OWNER_ID), any(Payload.class))).thenReturn(outcome);
        when(auditService.append(any(), any(), any(), anyString(), anyString(), any()))
                .thenThrow(new IdempotencyKeyConflictException(KEY, new RuntimeException("duplicate key")));
        CommandResult winner = CommandResult.ok(null, UUID.randomUUID()).toBuilder().cached(true).build();
        when(idempotencyGuard.awaitReplay(OWNER_ID, KEY)).thenReturn(winner);

        CommandResult result = router.handle(command("assignment", "create").idempotencyKey(KEY).build());

        assertThat(result).isSameAs(winner);
    }

    @Test
    void keyedRemoteCallRunsOutsideStoreTransaction() {
        AtomicBoolean inTransaction = new AtomicBoolean();
        TransactionOperations tracking = new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                inTransaction.set(true);
                try {
                    return action.doInTransaction(new SimpleTransactionStatus());
                } finally {
                    inTransaction.set(false);
                }
            }
        };
        List<EntityHandler> all = new ArrayList<>(handlers.values());
        CommandRouter trackingRouter = new CommandRouter(all, idempotencyGuard, auditService,
                tracking, new CommandMetrics(meterRegistry));

        EntityHandler generation = handlers.get(EntityKind.DOCUMENT_GENERATION);
        AtomicBoolean generatedInTransaction = new AtomicBoolean(true);
        AtomicBoolean appendedInTransaction = new AtomicBoolean();
        UUID auditId = UUID.randomUUID();
        AuditLog record = auditRecord(auditId);
        when(idempotencyGuard.lookup(OWNER_ID, KEY)).thenReturn(Optional.empty());
        when(generation.callsExternalService()).thenReturn(true);
        when(generation.create(eq(OWNER_ID), any(Payload.class))).thenAnswer(invocation -> {
            generatedInTransaction.set(inTransaction.get());
            return HandlerOutcome.mutation(null, null, JsonNodeFactory.instance.objectNode().put("title", "Notes"));
        });
        when(auditService.append(any(), any(), any(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            appendedInTransaction.set(inTransaction.get());
            return record;
        });

        CommandResult result = trackingRouter.handle(command("document_generation", "create").idempotencyKey(KEY).build());

        assertThat(result.isSuccess()).as("error: %s", result.getError()).isTrue();
        assertThat(result.getAuditLogId()).isEqualTo(auditId);
        assertThat(generatedInTransaction).isFalse();
        assertThat(appendedInTransaction).isTrue();
    }

    @Test
    void keyedAuditFailureFailsTheCommand() {
        when(idempotencyGuard.lookup(OWNER_ID, KEY)).thenReturn(Optional.empty());
        when(assignments().create(eq(OWNER_ID), any(Payload.class))).thenReturn(created(UUID.randomUUID()));
        when(auditService.append(any(), any(), any(), anyString(), anyString(), any()))
                .thenThrow(new AuditAppendException("Failed to append audit record", new RuntimeException()));

        CommandResult result = router.handle(command("assignment", "create").idempotencyKey(KEY).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
    }

    @Test
    void unkeyedAuditFailureReturnsDegradedSuccess() {
        UUID id = UUID.randomUUID();
        when(assignments().create(eq(OWNER_ID), any(Payload.class))).thenReturn(created(id));
        when(auditService.append(any(), any(), any(), anyString(), anyString(), any()))
                .thenThrow(new AuditAppendException("Failed to append audit record", new RuntimeException()));

        CommandResult result = router.handle(command("assignment", "create").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntityId()).isEqualTo(id);
        assertThat(result.getDegraded()).isTrue();
        assertThat(result.getAuditLogId()).isNull();
        assertThat(meterRegistry.get("planner_audit_failures_total")
                .tag("entity_kind", "assignment").counter().count()).isEqualTo(1.0);
    }

    @Test
    void handlerBusinessErrorKeepsItsCode() {
        UUID missing = UUID.randomUUID();
        when(assignments().update(eq(OWNER_ID), any(Payload.class)))
                .thenThrow(ResourceNotFoundException.entityNotFound(EntityKind.ASSIGNMENT, missing));

        CommandResult result = router.handle(command("assignment", "update").build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(result.getError()).contains(missing.toString());
        verifyNoInteractions(auditService);
    }

    @Test
    void unexpectedHandlerErrorBecomesWorkerErrorWithoutDetails() {
        when(assignments().create(eq(OWNER_ID), any(Payload.class)))
                .thenThrow(new IllegalStateException("connection reset by peer"));

        CommandResult result = router.handle(command("assignment", "create").build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.WORKER_ERROR);
        assertThat(result.getError()).isEqualTo("Command execution failed");
    }

    @Test
    void optimisticLockFailureBecomesVersionConflict() {
        when(assignments().update(eq(OWNER_ID), any(Payload.class)))
                .thenThrow(new OptimisticLockingFailureException("stale"));

        CommandResult result = router.handle(command("assignment", "update").build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VERSION_CONFLICT);
    }

    @Test
    void outcomeCounterIsTaggedWithErrorCode() {
        router.handle(command("spaceship", "create").build());

        assertThat(meterRegistry.get("planner_commands_total")
                .tag("entity_kind", "unknown")
                .tag("outcome", "UNKNOWN_ENTITY")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void everyEntityKindNeedsAHandler() {
        List<EntityHandler> incomplete = List.of(assignments());

        assertThatThrownBy(() -> new CommandRouter(incomplete, idempotencyGuard, auditService,
                TransactionOperations.withoutTransaction(), new CommandMetrics(meterRegistry)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No handler registered");
    }

    @Test
    void duplicateHandlersAreRejected() {
        List<EntityHandler> duplicated = new ArrayList<>(handlers.values());
        duplicated.add(assignments());

        assertThatThrownBy(() -> new CommandRouter(duplicated, idempotencyGuard, auditService,
                TransactionOperations.withoutTransaction(), new CommandMetrics(meterRegistry)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate handler");
    }
}
