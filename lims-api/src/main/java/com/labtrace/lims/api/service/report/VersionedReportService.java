package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.config.ReportProperties;
import com.labtrace.lims.api.domain.LabSettings;
import com.labtrace.lims.api.domain.ReportVersion;
import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.domain.enumeration.ReportStatus;
import com.labtrace.lims.api.repository.LabSettingsRepository;
import com.labtrace.lims.api.repository.ReportVersionRepository;
import com.labtrace.lims.api.repository.SampleRepository;
import com.labtrace.lims.api.service.audit.AuditFieldMaps;
import com.labtrace.lims.api.service.audit.AuditTrailService;
import com.labtrace.lims.api.service.error.LimsServiceException;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.api.service.error.ReportValidationException;
import com.labtrace.lims.api.service.error.ReportVersionConflictException;
import com.labtrace.lims.api.service.error.UpstreamFailureException;
import com.labtrace.lims.common.audit.AuditContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Versioned certificate reports for samples.
 * <p>
 * Slow work (snapshot rendering, document conversion, document storage) runs outside the database transaction.
 * Version allocation, demotion of the previous FINAL version, insertion of the new row and its audit entry share one
 * transaction that holds a row lock on the sample. A lost version race is retried once with a freshly computed
 * version number.
 */
@Service
public class VersionedReportService {

    private static final Logger log = LoggerFactory.getLogger(VersionedReportService.class);

    public static final String PDF_CONTENT_TYPE = "application/pdf";
    static final int MAX_ATTEMPTS = 2;

    private final SampleRepository sampleRepository;
    private final ReportVersionRepository reportVersionRepository;
    private final LabSettingsRepository labSettingsRepository;
    private final ReportSnapshotFactory snapshotFactory;
    private final ReportRenderer renderer;
    private final DocumentConverter converter;
    private final DocumentStore documentStore;
    private final AuditTrailService auditTrailService;
    private final ReportProperties properties;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final RetryTemplate retryTemplate;
    private final Timer exportLatency;

    public VersionedReportService(
        SampleRepository sampleRepository,
        ReportVersionRepository reportVersionRepository,
        LabSettingsRepository labSettingsRepository,
        ReportSnapshotFactory snapshotFactory,
        ReportRenderer renderer,
        DocumentConverter converter,
        DocumentStore documentStore,
        AuditTrailService auditTrailService,
        ReportProperties properties,
        PlatformTransactionManager transactionManager,
        MeterRegistry meterRegistry
    ) {
        this.sampleRepository = sampleRepository;
        this.reportVersionRepository = reportVersionRepository;
        this.labSettingsRepository = labSettingsRepository;
        this.snapshotFactory = snapshotFactory;
        this.renderer = renderer;
        this.converter = converter;
        this.documentStore = documentStore;
        this.auditTrailService = auditTrailService;
        this.properties = properties;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(MAX_ATTEMPTS)
            .fixedBackoff(50)
            .retryOn(ReportVersionConflictException.class)
            .build();
        this.exportLatency = Timer.builder("lims_report_export_latency")
            .description("Time to snapshot, render, convert, store and persist a report version")
            .register(meterRegistry);
    }

    /**
     * Creates the next FINAL version for a sample and supersedes the current one.
     */
    public ExportResult exportVersion(UUID sampleId, AuditContext context) {
        Objects.requireNonNull(sampleId, "sampleId");
        Objects.requireNonNull(context, "context").requireAttributable();
        Timer.Sample sample = Timer.start();
        try {
            return retryTemplate.execute(retry -> exportAttempt(sampleId, context, retry.getRetryCount() + 1));
        } finally {
            sample.stop(exportLatency);
        }
    }

    /**
     * Allocates the next version as a DRAFT without generating a document. Finalize it later with
     * {@link #finalizeDraft(UUID, AuditContext)}.
     */
    public ReportVersionView createDraft(UUID sampleId, AuditContext context) {
        Objects.requireNonNull(sampleId, "sampleId");
        Objects.requireNonNull(context, "context").requireAttributable();
        ReportVersion draft = retryTemplate.execute(retry -> {
            Prepared prepared = prepare(sampleId, context);
            return persistNew(prepared, context, null, false);
        });
        log.info("Created draft report v{} for sample {}", draft.getVersion(), sampleId);
        return view(draft);
    }

    public ReportVersionView finalizeDraft(UUID versionId, AuditContext context) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(context, "context").requireAttributable();
        ReportVersion draft = readTx.execute(status -> loadVersion(versionId));
        requireDraft(draft);

        StoredDocument generated = null;
        if (!draft.hasDocument()) {
            byte[] document = convert(draft.getRenderedSnapshot());
            generated = store(documentKey(sampleCode(draft), draft.getVersion()), document);
        }
        StoredDocument document = generated;

        ReportVersion finalized = writeTx.execute(status -> {
            lockSample(draft.getSampleId());
            ReportVersion current = loadVersion(versionId);
            requireDraft(current);
            List<ReportVersion> finals = reportVersionRepository.findBySampleIdAndStatus(current.getSampleId(), ReportStatus.FINAL);
            for (ReportVersion existing : finals) {
                if (existing.getVersion() > current.getVersion()) {
                    throw new ReportValidationException(
                        "Cannot finalize v" + current.getVersion() + ": v" + existing.getVersion() + " is already final for this sample"
                    );
                }
            }
            AuditContext tagged = context.withTransactionTag(auditTrailService.generateTransactionTag());
            Map<String, Object> before = AuditFieldMaps.reportVersion(current);
            demote(finals, tagged);
            if (document != null) {
                current.attachDocument(document.key(), document.sha256(), document.size());
            }
            current.markFinal(context.actorId(), Instant.now());
            ReportVersion saved = reportVersionRepository.saveAndFlush(current);
            auditTrailService.logUpdate(tagged, AuditFieldMaps.REPORT_VERSION, saved.getId(), before, AuditFieldMaps.reportVersion(saved));
            return saved;
        });
        log.info("Finalized report v{} for sample {}", finalized.getVersion(), finalized.getSampleId());
        return view(finalized);
    }

    /**
     * Records the approver of a FINAL version. The snapshot and document stay untouched.
     */
    public ReportVersionView approveVersion(UUID versionId, AuditContext context) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(context, "context").requireAttributable();
        ReportVersion approved = writeTx.execute(status -> {
            ReportVersion version = loadVersion(versionId);
            if (version.getStatus() != ReportStatus.FINAL) {
                throw new ReportValidationException("Only FINAL reports can be approved; v" + version.getVersion() + " is " + version.getStatus());
            }
            if (version.getApprovedById() != null) {
                throw new ReportValidationException("Report v" + version.getVersion() + " is already approved");
            }
            Map<String, Object> before = AuditFieldMaps.reportVersion(version);
            version.markApproved(context.actorId(), Instant.now());
            ReportVersion saved = reportVersionRepository.saveAndFlush(version);
            auditTrailService.logUpdate(context, AuditFieldMaps.REPORT_VERSION, saved.getId(), before, AuditFieldMaps.reportVersion(saved));
            return saved;
        });
        return view(approved);
    }

    public List<ReportVersionView> listVersions(UUID sampleId) {
        return readTx.execute(status -> {
            if (!sampleRepository.existsById(sampleId)) {
                throw new RecordNotFoundException("Sample", sampleId);
            }
            return reportVersionRepository.findBySampleIdOrderByVersionDesc(sampleId).stream().map(this::view).toList();
        });
    }

    public ReportVersionDetail getVersion(UUID versionId) {
        return readTx.execute(status -> {
            ReportVersion version = loadVersion(versionId);
            return new ReportVersionDetail(view(version), version.getDataSnapshot(), version.getRenderedSnapshot());
        });
    }

    public ReportVersionView getLatestVersion(UUID sampleId) {
        return readTx.execute(status ->
            reportVersionRepository
                .findFirstBySampleIdOrderByVersionDesc(sampleId)
                .map(this::view)
                .orElseThrow(() -> new RecordNotFoundException("Report version for sample", sampleId))
        );
    }

    /**
     * Bytes of the document a version references. Always the bytes stored when the version was generated.
     */
    public DocumentDownload downloadDocument(UUID versionId) {
        ReportVersion version = readTx.execute(status -> loadVersion(versionId));
        if (!version.hasDocument()) {
            throw new RecordNotFoundException("Document for report version", versionId);
        }
        byte[] content = documentStore.get(version.getDocumentKey());
        String expected = version.getDocumentSha256();
        if (expected != null && !expected.equalsIgnoreCase(FilesystemDocumentStore.sha256Hex(content))) {
            log.error("Document {} of report version {} failed its integrity check", version.getDocumentKey(), versionId);
            throw new UpstreamFailureException("Stored document for report version " + versionId + " failed its integrity check");
        }
        String fileName = sampleCode(version) + "-v" + version.getVersion() + ".pdf";
        return new DocumentDownload(versionId, fileName, PDF_CONTENT_TYPE, content);
    }

    /**
     * Snapshot and markup the next export would produce. Writes nothing.
     */
    public PreviewResult previewSnapshot(UUID sampleId, AuditContext context) {
        Objects.requireNonNull(sampleId, "sampleId");
        Prepared prepared = prepare(sampleId, context);
        return new PreviewResult(sampleId, prepared.sampleCode(), prepared.version(), prepared.snapshot().data(), prepared.markup());
    }

    private ExportResult exportAttempt(UUID sampleId, AuditContext context, int attempt) {
        Prepared prepared = prepare(sampleId, context);
        byte[] document = convert(prepared.markup());
        StoredDocument stored = store(documentKey(prepared.sampleCode(), prepared.version()), document);
        ReportVersion saved;
        try {
            saved = persistNew(prepared, context, stored, true);
        } catch (ReportVersionConflictException ex) {
            log.warn(
                "Export of sample {} lost v{} on attempt {}/{}; document {} is unreferenced",
                sampleId,
                prepared.version(),
                attempt,
                MAX_ATTEMPTS,
                stored.key()
            );
            throw ex;
        }
        log.info("Exported report v{} for sample {} as {}", saved.getVersion(), sampleId, saved.getDocumentKey());
        return new ExportResult(
            saved.getId(),
            saved.getVersion(),
            saved.getStatus(),
            saved.getDocumentKey(),
            downloadUrl(saved.getId()),
            "Report version " + saved.getVersion() + " exported"
        );
    }

    private Prepared prepare(UUID sampleId, AuditContext context) {
        Prepared prepared = readTx.execute(status -> {
            Sample sample = sampleRepository.findWithReportDataById(sampleId).orElseThrow(() -> new RecordNotFoundException("Sample", sampleId));
            int next = reportVersionRepository.findMaxVersion(sampleId) + 1;
            LabSettings settings = labSettingsRepository.findFirstByOrderByCreatedDateAsc().orElse(null);
            ReportSnapshot snapshot = snapshotFactory.build(sample, next, context, settings);
            return new Prepared(sampleId, sample.getSampleCode(), next, snapshot, null);
        });
        return prepared.withMarkup(render(prepared.snapshot()));
    }

    private ReportVersion persistNew(Prepared prepared, AuditContext context, StoredDocument document, boolean asFinal) {
        try {
            return writeTx.execute(status -> {
                lockSample(prepared.sampleId());
                int current = reportVersionRepository.findMaxVersion(prepared.sampleId());
                if (current + 1 != prepared.version()) {
                    throw new ReportVersionConflictException(
                        "Version " + prepared.version() + " of sample " + prepared.sampleCode() + " was allocated concurrently"
                    );
                }
                AuditContext tagged = context.transactionTag() != null
                    ? context
                    : context.withTransactionTag(auditTrailService.generateTransactionTag());
                ReportVersion version = new ReportVersion(
                    prepared.sampleId(),
                    prepared.version(),
                    prepared.snapshot().data(),
                    prepared.markup(),
                    context.actorId()
                );
                if (document != null) {
                    version.attachDocument(document.key(), document.sha256(), document.size());
                }
                if (asFinal) {
                    demote(reportVersionRepository.findBySampleIdAndStatus(prepared.sampleId(), ReportStatus.FINAL), tagged);
                    version.markFinal(context.actorId(), Instant.now());
                }
                ReportVersion saved = reportVersionRepository.saveAndFlush(version);
                auditTrailService.logCreate(tagged, AuditFieldMaps.REPORT_VERSION, saved.getId(), AuditFieldMaps.reportVersion(saved));
                return saved;
            });
        } catch (DataIntegrityViolationException ex) {
            throw new ReportVersionConflictException(
                "Version " + prepared.version() + " of sample " + prepared.sampleCode() + " already exists",
                ex
            );
        }
    }

    /**
     * Flushed before the new FINAL row is inserted so the one-final-per-sample index never sees two.
     */
    private void demote(List<ReportVersion> finals, AuditContext context) {
        if (finals.isEmpty()) {
            return;
        }
        for (ReportVersion previous : finals) {
            Map<String, Object> before = AuditFieldMaps.reportVersion(previous);
            previous.markSuperseded();
            auditTrailService.logUpdate(context, AuditFieldMaps.REPORT_VERSION, previous.getId(), before, AuditFieldMaps.reportVersion(previous));
            log.debug("Superseded report v{} of sample {}", previous.getVersion(), previous.getSampleId());
        }
        reportVersionRepository.saveAllAndFlush(finals);
    }

    private void lockSample(UUID sampleId) {
        sampleRepository.findByIdForUpdate(sampleId).orElseThrow(() -> new RecordNotFoundException("Sample", sampleId));
    }

    private ReportVersion loadVersion(UUID versionId) {
        return reportVersionRepository.findById(versionId).orElseThrow(() -> new RecordNotFoundException("Report version", versionId));
    }

    private static void requireDraft(ReportVersion version) {
        if (version.getStatus() != ReportStatus.DRAFT) {
            throw new ReportValidationException("Only DRAFT reports can be finalized; v" + version.getVersion() + " is " + version.getStatus());
        }
    }

    private String render(ReportSnapshot snapshot) {
        try {
            return renderer.render(snapshot);
        } catch (LimsServiceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Report rendering failed: " + ex.getMessage(), ex);
        }
    }

    private byte[] convert(String markup) {
        try {
            return converter.convert(markup, ConversionOptions.from(properties.getConverter()));
        } catch (LimsServiceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Document conversion failed: " + ex.getMessage(), ex);
        }
    }

    private StoredDocument store(String key, byte[] content) {
        try {
            return documentStore.put(key, content, PDF_CONTENT_TYPE);
        } catch (LimsServiceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Document storage failed for " + key + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * {@code {prefix}/{sampleCode}-v{version}-{epochMillis}-{random}.pdf}; never reused.
     */
    String documentKey(String sampleCode, int version) {
        String code = StringUtils.defaultIfBlank(sampleCode, "sample").replaceAll("[^A-Za-z0-9._-]", "_");
        String prefix = StringUtils.removeEnd(StringUtils.defaultString(properties.getStoragePrefix()), "/");
        String name = code + "-v" + version + "-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8) + ".pdf";
        return prefix.isEmpty() ? name : prefix + "/" + name;
    }

    private String downloadUrl(UUID versionId) {
        return properties.getDownloadPathTemplate().replace("{id}", versionId.toString());
    }

    private ReportVersionView view(ReportVersion version) {
        return ReportVersionView.from(version, version.getId() != null ? downloadUrl(version.getId()) : null);
    }

    private static String sampleCode(ReportVersion version) {
        Object sample = version.getDataSnapshot().get(ReportSnapshotFactory.SAMPLE);
        if (sample instanceof Map<?, ?> fields && fields.get("sampleCode") != null) {
            return String.valueOf(fields.get("sampleCode"));
        }
        return String.valueOf(version.getSampleId());
    }

    private record Prepared(UUID sampleId, String sampleCode, int version, ReportSnapshot snapshot, String markup) {
        Prepared withMarkup(String rendered) {
            return new Prepared(sampleId, sampleCode, version, snapshot, rendered);
        }
    }
}
