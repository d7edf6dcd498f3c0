package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.api.domain.AuditEntry;
import com.labtrace.lims.common.audit.AuditAction;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AuditEntryView(
    UUID id,
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
    public static AuditEntryView from(AuditEntry entry) {
        return new AuditEntryView(
            entry.getId(),
            entry.getActorId(),
            entry.getActorEmail(),
            entry.getIp(),
            entry.getUserAgent(),
            entry.getAction(),
            entry.getSubjectType(),
            entry.getSubjectId(),
            entry.getChanges(),
            entry.getReason(),
            entry.getTransactionTag(),
            entry.getAt()
        );
    }
}
