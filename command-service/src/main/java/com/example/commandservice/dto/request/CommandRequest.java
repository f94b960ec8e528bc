package com.example.commandservice.dto.request;

import com.example.commandservice.dto.Command;
import com.example.commandservice.entity.AuditSource;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Wire form of a command. The owner is never read from the body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CommandRequest {

    private String intent;

    @JsonAlias("entity_type")
    private String entityKind;

    private String action;

    private ObjectNode payload;

    private String requestId;

    private String idempotencyKey;

    private UUID transactionId;

    private AuditSource source;

    public Command toCommand(UUID ownerId) {
        return Command.builder()
                .ownerId(ownerId)
                .intent(intent)
                .entityKind(entityKind)
                .action(action)
                .payload(payload)
                .requestId(requestId)
                .idempotencyKey(idempotencyKey)
                .transactionId(transactionId)
                .source(source != null ? source : AuditSource.API)
                .build();
    }
}
