package com.example.commandservice.exception;

import com.example.commandservice.entity.EntityKind;

import java.util.UUID;

/**
 * Record absent or owned by someone else (HTTP 404). The two cases are reported identically.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static ResourceNotFoundException entityNotFound(EntityKind kind, UUID id) {
        return new ResourceNotFoundException(
                String.format("%s with ID %s not found", kind.getWireName(), id));
    }

    /**
     * A referenced record (course_id, semester_id, ...) does not belong to the caller.
     */
    public static ResourceNotFoundException referenceNotFound(String field, UUID id) {
        return new ResourceNotFoundException(
                String.format("Referenced %s %s not found", field, id));
    }
}
