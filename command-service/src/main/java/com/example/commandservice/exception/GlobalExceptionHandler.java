package com.example.commandservice.exception;

import com.example.commandservice.dto.response.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps anything escaping a controller to the command envelope.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<CommandResult> handleBaseException(BaseException ex) {
        log.warn("Business exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        return respond(CommandResult.failure(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommandResult> handleValidationException(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError fieldError
                        ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", details);
        return respond(CommandResult.failure(ErrorCode.INVALID_PAYLOAD, details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommandResult> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(CommandResult.failure(ErrorCode.INVALID_PAYLOAD, "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<CommandResult> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid path or query parameter {}: {}", ex.getName(), ex.getValue());
        return respond(CommandResult.failure(ErrorCode.INVALID_PAYLOAD,
                "Invalid value for " + ex.getName() + ": " + ex.getValue()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommandResult> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return respond(CommandResult.failure(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred"));
    }

    private static ResponseEntity<CommandResult> respond(CommandResult result) {
        return ResponseEntity.status(result.httpStatus()).body(result);
    }
}
