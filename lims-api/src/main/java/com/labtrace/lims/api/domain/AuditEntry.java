package com.labtrace.lims.api.domain;

import com.labtrace.lims.common.audit.AuditAction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

/**
 * One row of the append-only audit ledger. Instances are built complete and never change afterwards.
 */
@Entity
@Immutable
@Table(name = "audit_entry")
public class AuditEntry implements Persistable<UUID>, Serializable {

    private static final long serialVersionUID = 1L;

    public static final String IMMUTABLE_MESSAGE = "AuditLog records are immutable and cannot be modified or deleted";

    @Id
    @Column(name = "id", columnDefinition = "uuid", updatable = false)
    private UUID id;

    @Column(name = "actor_id", nullable = false, length = 128, updatable = false)
    private String actorId;

    @Column(name = "actor_email", nullable = false, length = 255, updatable = false)
    private String actorEmail;

    @Column(name = "ip", length = 64, updatable = false)
    private String ip;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 16, updatable = false)
    private AuditAction action;

    @Column(name = "subject_type", nullable = false, length = 64, updatable = false)
    private String subjectType;

    @Column(name = "subject_id", nullable = false, length = 64, updatable = false)
    private String subjectId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "changes", updatable = false)
    private Map<String, Object> changes = new LinkedHashMap<>();

    @Column(name = "reason", length = 1024, updatable = false)
    private String reason;

    @Column(name = "transaction_tag", length = 128, updatable = false)
    private String transactionTag;

    @Column(name = "at", nullable = false, updatable = false)
    private Instant at;

    @Transient
    private boolean persisted;

    protected AuditEntry() {}

    public AuditEntry(
        String actorId,
        String actorEmail,
        String ip,
        String userAgent,
        AuditAction action,
        String subjectType,
        String subjectId,
        Map<String, Object> changes,
        String reason,
        String transactionTag,
        Instant at
    ) {
        this.id = UUID.randomUUID();
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.actorEmail = Objects.requireNonNull(actorEmail, "actorEmail");
        this.ip = ip;
        this.userAgent = userAgent;
        this.action = Objects.requireNonNull(action, "action");
        this.subjectType = Objects.requireNonNull(subjectType, "subjectType");
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.changes = changes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(changes);
        this.reason = reason;
        this.transactionTag = transactionTag;
        this.at = Objects.requireNonNull(at, "at");
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.persisted = true;
    }

    @PreUpdate
    @PreRemove
    void rejectModification() {
        throw new IllegalStateException(IMMUTABLE_MESSAGE);
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    public String getActorId() {
        return actorId;
    }

    public String getActorEmail() {
        return actorEmail;
    }

    public String getIp() {
        return ip;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public AuditAction getAction() {
        return action;
    }

    public String getSubjectType() {
        return subjectType;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Map<String, Object> getChanges() {
        return Collections.unmodifiableMap(changes);
    }

    public String getReason() {
        return reason;
    }

    public String getTransactionTag() {
        return transactionTag;
    }

    public Instant getAt() {
        return at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditEntry)) {
            return false;
        }
        return id != null && id.equals(((AuditEntry) o).id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return (
            "AuditEntry{id=" +
            id +
            ", action=" +
            action +
            ", subjectType='" +
            subjectType +
            "', subjectId='" +
            subjectId +
            "', actorId='" +
            actorId +
            "', transactionTag='" +
            transactionTag +
            "', at=" +
            at +
            "}"
        );
    }
}
