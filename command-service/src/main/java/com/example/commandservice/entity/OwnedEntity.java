package com.example.commandservice.entity;

import java.util.UUID;

/**
 * A record that belongs to exactly one owner. The owner never changes after creation.
 */
public interface OwnedEntity {

    UUID getId();

    UUID getOwnerId();
}
