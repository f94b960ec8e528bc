package com.example.commandservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy of the command envelope. Each code carries the HTTP status it maps to.
 */
@Getter
public enum ErrorCode {
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED),
    UNKNOWN_ENTITY(HttpStatus.BAD_REQUEST),
    UNKNOWN_ACTION(HttpStatus.BAD_REQUEST),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST),
    NOT_IMPLEMENTED(HttpStatus.BAD_REQUEST),
    WORKER_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    VERSION_CONFLICT(HttpStatus.CONFLICT),
    IDEMPOTENCY_KEY_REUSED(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }
}
