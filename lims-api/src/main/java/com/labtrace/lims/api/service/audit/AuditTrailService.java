package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.api.domain.AuditEntry;
import com.labtrace.lims.api.repository.AuditEntryRepository;
import com.labtrace.lims.common.audit.AuditAction;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.audit.ChangeDiffEngine;
import com.labtrace.lims.common.audit.ChangeSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append side of the audit ledger. Every write joins the caller's transaction, so a failed append rolls back the
 * business mutation it describes.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final AuditEntryRepository repository;
    private final ChangeDiffEngine diffEngine;
    private final Counter writeSuccess;
    private final Counter writeFail;
    private final Counter writeSkipped;
    private final AtomicReference<Instant> lastTimestamp = new AtomicReference<>(Instant.EPOCH);

    public AuditTrailService(AuditEntryRepository repository, MeterRegistry registry) {
        this.repository = repository;
        this.diffEngine = ChangeDiffEngine.DEFAULT;
        this.writeSuccess = Counter.builder("lims_audit_write_total").tag("status", "success").register(registry);
        this.writeFail = Counter.builder("lims_audit_write_total").tag("status", "fail").register(registry);
        this.writeSkipped = Counter.builder("lims_audit_write_total").tag("status", "noop").register(registry);
    }

    public AuditEntryView logCreate(AuditContext context, String subjectType, Object subjectId, Map<String, ?> newFields) {
        return logCreate(context, subjectType, subjectId, newFields, null);
    }

    public AuditEntryView logCreate(AuditContext context, String subjectType, Object subjectId, Map<String, ?> newFields, String reason) {
        ChangeSet changes = diffEngine.diffForCreate(newFields);
        return append(context, AuditAction.CREATE, subjectType, subjectId, changes, reason);
    }

    public Optional<AuditEntryView> logUpdate(
        AuditContext context,
        String subjectType,
        Object subjectId,
        Map<String, ?> oldFields,
        Map<String, ?> newFields
    ) {
        return logUpdate(context, subjectType, subjectId, oldFields, newFields, null);
    }

    /**
     * @return empty when nothing changed; no entry is written in that case
     */
    public Optional<AuditEntryView> logUpdate(
        AuditContext context,
        String subjectType,
        Object subjectId,
        Map<String, ?> oldFields,
        Map<String, ?> newFields,
        String reason
    ) {
        ChangeSet changes = diffEngine.diffForUpdate(oldFields, newFields);
        if (changes.isEmpty()) {
            writeSkipped.increment();
            log.debug("No changes for {} {}, skipping audit entry", subjectType, subjectId);
            return Optional.empty();
        }
        return Optional.of(append(context, AuditAction.UPDATE, subjectType, subjectId, changes, reason));
    }

    public AuditEntryView logDelete(AuditContext context, String subjectType, Object subjectId, Map<String, ?> oldFields) {
        return logDelete(context, subjectType, subjectId, oldFields, null);
    }

    public AuditEntryView logDelete(AuditContext context, String subjectType, Object subjectId, Map<String, ?> oldFields, String reason) {
        ChangeSet changes = diffEngine.diffForDelete(oldFields);
        return append(context, AuditAction.DELETE, subjectType, subjectId, changes, reason);
    }

    /**
     * Tag tying together the entries of one multi-record operation.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public String generateTransactionTag() {
        return "tx-" + UUID.randomUUID();
    }

    private AuditEntryView append(
        AuditContext context,
        AuditAction action,
        String subjectType,
        Object subjectId,
        ChangeSet changes,
        String reason
    ) {
        Objects.requireNonNull(context, "context").requireAttributable();
        Objects.requireNonNull(subjectType, "subjectType");
        Objects.requireNonNull(subjectId, "subjectId");
        AuditEntry entry = new AuditEntry(
            context.actorId(),
            context.actorEmail(),
            context.ip(),
            context.userAgent(),
            action,
            subjectType,
            String.valueOf(subjectId),
            changes.toMap(),
            reason,
            context.transactionTag(),
            nextTimestamp()
        );
        try {
            AuditEntry saved = repository.saveAndFlush(entry);
            writeSuccess.increment();
            return AuditEntryView.from(saved);
        } catch (DataIntegrityViolationException ex) {
            writeFail.increment();
            log.warn("[AUDIT_PERSIST_FAIL] integrity violation for {} {} {}", action, subjectType, subjectId, ex);
            throw ex;
        } catch (RuntimeException ex) {
            writeFail.increment();
            log.error("[AUDIT_PERSIST_FAIL] error saving audit entry for {} {} {}", action, subjectType, subjectId, ex);
            throw ex;
        }
    }

    /**
     * Strictly increasing within this process at the ledger's microsecond precision.
     */
    Instant nextTimestamp() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        return lastTimestamp.updateAndGet(previous -> now.isAfter(previous) ? now : previous.plus(1, ChronoUnit.MICROS));
    }
}
