package com.example.commandservice.dto;

import lombok.Value;

import java.util.UUID;

/**
 * Correlation for the commands of one user intent. Only tags audit records; there is no
 * rollback or compensation across commands.
 */
@Value
public class TransactionContext {
    UUID transactionId;
    String intent;

    public static TransactionContext begin(UUID transactionId, String intent) {
        return new TransactionContext(transactionId != null ? transactionId : UUID.randomUUID(), intent);
    }

    /**
     * Stamp a step with this transaction id; the step keeps its own intent when it has one.
     */
    public Command stamp(Command command) {
        boolean hasIntent = command.getIntent() != null && !command.getIntent().isBlank();
        return command.toBuilder()
                .transactionId(transactionId)
                .intent(hasIntent ? command.getIntent() : intent)
                .build();
    }
}
