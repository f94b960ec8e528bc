package com.example.commandservice.service;

import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.entity.AuditLog;
import com.example.commandservice.exception.IdempotencyKeyReusedException;
import com.example.commandservice.exception.WorkerException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyGuardTest {

    private static final UUID OWNER_ID = UUID.randomUUID();
    private static final String KEY = "turn-9";

    @Mock
    private AuditService auditService;

    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        guard = new IdempotencyGuard(auditService, 3, 1);
    }

    private static AuditLog recordOf(UUID ownerId) {
        AuditLog record = mock(AuditLog.class);
        when(record.getOwnerId()).thenReturn(ownerId);
        return record;
    }

    @Test
    void blankKeyIsNeverLookedUp() {
        assertThat(guard.lookup(OWNER_ID, " ")).isEmpty();
        assertThat(guard.lookup(OWNER_ID, null)).isEmpty();
        verifyNoInteractions(auditService);
    }

    @Test
    void unusedKeyHasNoReplay() {
        when(auditService.findByIdempotencyKey(KEY)).thenReturn(Optional.empty());

        assertThat(guard.lookup(OWNER_ID, KEY)).isEmpty();
    }

    @Test
    void recordedKeyReplaysAfterState() {
        UUID entityId = UUID.randomUUID();
        UUID auditId = UUID.randomUUID();
        ObjectNode state = JsonNodeFactory.instance.objectNode().put("title", "Essay");
        AuditLog record = recordOf(OWNER_ID);
        when(record.getId()).thenReturn(auditId);
        when(record.getEntityId()).thenReturn(entityId);
        when(record.getAfterState()).thenReturn("{\"title\":\"Essay\"}");
        when(auditService.findByIdempotencyKey(KEY)).thenReturn(Optional.of(record));
        when(auditService.readState(record, "{\"title\":\"Essay\"}")).thenReturn(state);

        CommandResult replay = guard.lookup(OWNER_ID, KEY).orElseThrow();

        assertThat(replay.isSuccess()).isTrue();
        assertThat(replay.getCached()).isTrue();
        assertThat(replay.getEntityId()).isEqualTo(entityId);
        assertThat(replay.getAuditLogId()).isEqualTo(auditId);
        assertThat(replay.getData()).isEqualTo(state);
    }

    @Test
    void keyOfAnotherOwnerIsRejected() {
        AuditLog record = recordOf(UUID.randomUUID());
        when(record.getIdempotencyKey()).thenReturn(KEY);
        when(auditService.findByIdempotencyKey(KEY)).thenReturn(Optional.of(record));

        assertThatThrownBy(() -> guard.lookup(OWNER_ID, KEY))
                .isInstanceOf(IdempotencyKeyReusedException.class);
    }

    @Test
    void awaitReplayGivesUpAfterConfiguredAttempts() {
        when(auditService.findByIdempotencyKey(KEY)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> guard.awaitReplay(OWNER_ID, KEY))
                .isInstanceOf(WorkerException.class);
        verify(auditService, times(3)).findByIdempotencyKey(KEY);
    }
}
