package com.example.commandservice.dto.response;

import com.example.commandservice.entity.AuditSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuditRecordResponse {
    private UUID id;
    private String action;
    private String entityKind;
    private UUID entityId;
    private JsonNode beforeState;
    private JsonNode afterState;
    private AuditSource source;
    private String requestId;
    private UUID transactionId;
    private String idempotencyKey;
    private String intent;
    private Instant createdAt;
}
