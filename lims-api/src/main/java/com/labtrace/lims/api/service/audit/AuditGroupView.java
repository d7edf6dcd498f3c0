package com.labtrace.lims.api.service.audit;

import java.time.Instant;
import java.util.List;

/**
 * Entries of one logical operation. {@code groupKey} is the transaction tag, or the entry id for untagged entries.
 * Timestamp and provenance come from the most recent member.
 */
public record AuditGroupView(
    String groupKey,
    String transactionTag,
    Instant timestamp,
    String actorId,
    String actorEmail,
    String ip,
    String userAgent,
    List<AuditEntryView> entries
) {}
