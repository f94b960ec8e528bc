package com.example.commandservice.exception;

/**
 * A handler or downstream worker failed to carry out the command (HTTP 400).
 */
public class WorkerException extends BaseException {

    public WorkerException(String message) {
        super(ErrorCode.WORKER_ERROR, message);
    }

    public WorkerException(String message, Throwable cause) {
        super(ErrorCode.WORKER_ERROR, message, cause);
    }
}
