package com.example.commandservice.exception;

public class UnknownCommandException extends BaseException {

    private UnknownCommandException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static UnknownCommandException unknownEntity(String entityKind) {
        return new UnknownCommandException(ErrorCode.UNKNOWN_ENTITY, "Unknown entity kind: " + entityKind);
    }

    public static UnknownCommandException unknownAction(String action) {
        return new UnknownCommandException(ErrorCode.UNKNOWN_ACTION, "Unknown action: " + action);
    }
}
