package com.example.commandservice.exception;

/**
 * The idempotency key already belongs to a command of another owner (HTTP 409).
 */
public class IdempotencyKeyReusedException extends BaseException {

    public IdempotencyKeyReusedException(String idempotencyKey) {
        super(ErrorCode.IDEMPOTENCY_KEY_REUSED,
                "Idempotency key " + idempotencyKey + " was already used by another caller");
    }
}
