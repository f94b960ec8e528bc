package com.example.commandservice.service;

import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.entity.AuditLog;
import com.example.commandservice.exception.IdempotencyKeyReusedException;
import com.example.commandservice.exception.WorkerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Replays results of already executed keyed commands from the audit ledger.
 *
 * <p>The key is reserved by the unique constraint on audit_log.idempotency_key, not here: this
 * class only reads committed records.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private final AuditService auditService;
    private final int replayPollAttempts;
    private final long replayPollIntervalMs;

    public IdempotencyGuard(AuditService auditService,
                            @Value("${planner.idempotency.replay-poll-attempts:20}") int replayPollAttempts,
                            @Value("${planner.idempotency.replay-poll-interval-ms:50}") long replayPollIntervalMs) {
        this.auditService = auditService;
        this.replayPollAttempts = replayPollAttempts;
        this.replayPollIntervalMs = replayPollIntervalMs;
    }

    /**
     * Cached envelope for {@code idempotencyKey}, or empty when the key has not been used.
     *
     * @throws IdempotencyKeyReusedException if the key belongs to another owner
     */
    public Optional<CommandResult> lookup(UUID ownerId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        return auditService.findByIdempotencyKey(idempotencyKey)
                .map(record -> replay(ownerId, record));
    }

    /**
     * Wait for the concurrent winner of a key collision to commit, then replay its record.
     */
    public CommandResult awaitReplay(UUID ownerId, String idempotencyKey) {
        for (int attempt = 1; attempt <= replayPollAttempts; attempt++) {
            Optional<CommandResult> replay = lookup(ownerId, idempotencyKey);
            if (replay.isPresent()) {
                log.info("Replayed concurrent winner: key={}, attempt={}", idempotencyKey, attempt);
                return replay.get();
            }
            try {
                Thread.sleep(replayPollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerException("Interrupted while waiting for concurrent command", e);
            }
        }
        log.warn("Concurrent command did not commit in time: key={}", idempotencyKey);
        throw new WorkerException("A concurrent command with the same idempotency key did not complete; retry with the same key");
    }

    private CommandResult replay(UUID ownerId, AuditLog record) {
        if (!record.getOwnerId().equals(ownerId)) {
            log.warn("Idempotency key reused across owners: key={}", record.getIdempotencyKey());
            throw new IdempotencyKeyReusedException(record.getIdempotencyKey());
        }
        return CommandResult.builder()
                .success(true)
                .data(auditService.readState(record, record.getAfterState()))
                .entityId(record.getEntityId())
                .auditLogId(record.getId())
                .cached(true)
                .build();
    }
}
