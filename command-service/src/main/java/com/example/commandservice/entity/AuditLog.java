package com.example.commandservice.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Provenance record for one successful mutating command.
 *
 * <p>Append-only: no setters, never updated or deleted. before/after states are JSON text.
 * idempotency_key is unique where present; that constraint is the only cross-request
 * mutual exclusion in the service.
 */
@Entity
@Table(name = "audit_log", uniqueConstraints = {
    @UniqueConstraint(name = AuditLog.IDEMPOTENCY_KEY_CONSTRAINT, columnNames = "idempotency_key")
}, indexes = {
    @Index(name = "idx_audit_log_owner_entity", columnList = "owner_id, entity_kind, entity_id"),
    @Index(name = "idx_audit_log_transaction", columnList = "transaction_id"),
    @Index(name = "idx_audit_log_created_at", columnList = "created_at")
})
public class AuditLog {

    public static final String IDEMPOTENCY_KEY_CONSTRAINT = "uq_audit_log_idempotency_key";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "action", nullable = false, length = 20, updatable = false)
    private String action;

    @Column(name = "entity_kind", nullable = false, length = 50, updatable = false)
    private String entityKind;

    // NULL for kinds without a stored record (document generation)
    @Column(name = "entity_id", updatable = false)
    private UUID entityId;

    @Column(name = "before_state", columnDefinition = "TEXT", updatable = false)
    private String beforeState;

    @Column(name = "after_state", columnDefinition = "TEXT", updatable = false)
    private String afterState;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20, updatable = false)
    private AuditSource source;

    @Column(name = "request_id", columnDefinition = "TEXT", updatable = false)
    private String requestId;

    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Column(name = "idempotency_key", length = 255, updatable = false)
    private String idempotencyKey;

    @Column(name = "intent", columnDefinition = "TEXT", updatable = false)
    private String intent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.ownerId = builder.ownerId;
        this.action = builder.action;
        this.entityKind = builder.entityKind;
        this.entityId = builder.entityId;
        this.beforeState = builder.beforeState;
        this.afterState = builder.afterState;
        this.source = builder.source;
        this.requestId = builder.requestId;
        this.transactionId = builder.transactionId;
        this.idempotencyKey = builder.idempotencyKey;
        this.intent = builder.intent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID ownerId;
        private String action;
        private String entityKind;
        private UUID entityId;
        private String beforeState;
        private String afterState;
        private AuditSource source = AuditSource.API;
        private String requestId;
        private UUID transactionId;
        private String idempotencyKey;
        private String intent;

        public Builder ownerId(UUID ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder action(CommandAction action) {
            this.action = action.getWireName();
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind.getWireName();
            return this;
        }

        public Builder entityId(UUID entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder beforeState(String beforeState) {
            this.beforeState = beforeState;
            return this;
        }

        public Builder afterState(String afterState) {
            this.afterState = afterState;
            return this;
        }

        public Builder source(AuditSource source) {
            this.source = source != null ? source : AuditSource.API;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder transactionId(UUID transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    // Getters only (append-only)
    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public String getAction() { return action; }
    public String getEntityKind() { return entityKind; }
    public UUID getEntityId() { return entityId; }
    public String getBeforeState() { return beforeState; }
    public String getAfterState() { return afterState; }
    public AuditSource getSource() { return source; }
    public String getRequestId() { return requestId; }
    public UUID getTransactionId() { return transactionId; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public String getIntent() { return intent; }
    public Instant getCreatedAt() { return createdAt; }
}
