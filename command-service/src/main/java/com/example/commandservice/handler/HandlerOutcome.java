package com.example.commandservice.handler;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What a handler produced: the response data plus the before/after snapshots the ledger records.
 * For mutations {@code data} is the after state.
 */
@Value
@Builder
public class HandlerOutcome {

    JsonNode data;
    UUID entityId;
    JsonNode beforeState;
    JsonNode afterState;

    public static HandlerOutcome read(JsonNode data, UUID entityId) {
        return HandlerOutcome.builder().data(data).entityId(entityId).build();
    }

    public static HandlerOutcome mutation(UUID entityId, JsonNode beforeState, JsonNode afterState) {
        return HandlerOutcome.builder()
                .data(afterState)
                .entityId(entityId)
                .beforeState(beforeState)
                .afterState(afterState)
                .build();
    }
}
