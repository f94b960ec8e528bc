package com.example.commandservice.dto;

import com.example.commandservice.entity.AuditSource;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A structured command as seen by the router. {@code entityKind} and {@code action} are kept
 * raw so the router can reject unknown values itself. {@code ownerId} always comes from the
 * verified token.
 */
@Value
@Builder(toBuilder = true)
public class Command {
    UUID ownerId;
    String intent;
    String entityKind;
    String action;
    ObjectNode payload;
    String requestId;
    String idempotencyKey;
    UUID transactionId;
    AuditSource source;

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
