package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditAction;
import java.time.Instant;
import org.apache.commons.lang3.StringUtils;

/**
 * Ledger filters; every field is optional and they combine with AND. {@code from} and {@code to} are inclusive.
 */
public record AuditSearchCriteria(
    String subjectType,
    String subjectId,
    String actorId,
    AuditAction action,
    Instant from,
    Instant to,
    String transactionTag
) {
    public AuditSearchCriteria {
        subjectType = StringUtils.trimToNull(subjectType);
        subjectId = StringUtils.trimToNull(subjectId);
        actorId = StringUtils.trimToNull(actorId);
        transactionTag = StringUtils.trimToNull(transactionTag);
    }

    public static AuditSearchCriteria none() {
        return new AuditSearchCriteria(null, null, null, null, null, null, null);
    }
}
