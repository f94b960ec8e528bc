package com.example.commandservice.exception;

/**
 * Payload field missing, malformed or out of range (HTTP 400).
 */
public class InvalidPayloadException extends BaseException {

    public InvalidPayloadException(String message) {
        super(ErrorCode.INVALID_PAYLOAD, message);
    }

    public static InvalidPayloadException missingField(String field) {
        return new InvalidPayloadException("Missing required field: " + field);
    }

    public static InvalidPayloadException nullNotAllowed(String field) {
        return new InvalidPayloadException("Field cannot be null: " + field);
    }

    public static InvalidPayloadException invalidValue(String field, Object value) {
        return new InvalidPayloadException(String.format("Invalid value for %s: %s", field, value));
    }

    public static InvalidPayloadException outOfRange(String field, int min, int max) {
        return new InvalidPayloadException(
                String.format("Field %s must be between %d and %d", field, min, max));
    }
}
