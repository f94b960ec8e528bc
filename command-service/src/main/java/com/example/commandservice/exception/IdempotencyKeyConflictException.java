package com.example.commandservice.exception;

/**
 * Raised when the audit insert of a keyed command loses the race on the unique
 * idempotency_key constraint. The surrounding store transaction must roll back;
 * the router then replays the winning record.
 */
public class IdempotencyKeyConflictException extends BaseException {

    public IdempotencyKeyConflictException(String idempotencyKey, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, "Idempotency key already recorded: " + idempotencyKey, cause);
    }
}
