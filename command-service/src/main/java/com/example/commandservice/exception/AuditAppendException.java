package com.example.commandservice.exception;

public class AuditAppendException extends BaseException {

    public AuditAppendException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
