package com.example.commandservice.repository;

import com.example.commandservice.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger access. Only inserts and reads are used; nothing updates or deletes audit rows.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    Optional<AuditLog> findByIdempotencyKey(String idempotencyKey);

    List<AuditLog> findByOwnerIdAndTransactionIdOrderByCreatedAtAsc(UUID ownerId, UUID transactionId);

    List<AuditLog> findByOwnerIdAndEntityKindAndEntityIdOrderByCreatedAtAsc(
            UUID ownerId, String entityKind, UUID entityId);

    long countByOwnerId(UUID ownerId);
}
