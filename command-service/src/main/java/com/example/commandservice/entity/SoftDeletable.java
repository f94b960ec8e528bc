package com.example.commandservice.entity;

/**
 * Entity kinds with a {@link DeletionPolicy#LOGICAL} delete.
 */
public interface SoftDeletable {

    Boolean getIsActive();

    void deactivate();
}
