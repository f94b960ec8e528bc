package com.example.commandservice.entity;

/**
 * How a delete command is applied to an entity kind.
 */
public enum DeletionPolicy {
    /** Row stays, is_active flips to false. */
    LOGICAL,
    /** Row is removed; the audit record keeps the before state. */
    PHYSICAL,
    /** Kind has no delete operation. */
    UNSUPPORTED
}
