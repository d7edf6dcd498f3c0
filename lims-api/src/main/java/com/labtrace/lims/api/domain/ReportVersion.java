package com.labtrace.lims.api.domain;

import com.labtrace.lims.api.domain.enumeration.ReportStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreRemove;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One numbered certificate version of a sample. The data snapshot, rendered markup and stored document are written
 * once; only status and sign-off stamps move afterwards.
 */
@Entity
@Table(
    name = "report_version",
    uniqueConstraints = { @UniqueConstraint(name = "uk_report_version_sample_version", columnNames = { "sample_id", "version" }) }
)
public class ReportVersion implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "sample_id", columnDefinition = "uuid", nullable = false, updatable = false)
    private UUID sampleId;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReportStatus status = ReportStatus.DRAFT;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "data_snapshot", nullable = false, updatable = false)
    private Map<String, Object> dataSnapshot;

    @Column(name = "rendered_snapshot", columnDefinition = "text", nullable = false, updatable = false)
    private String renderedSnapshot;

    @Column(name = "document_key", length = 512)
    private String documentKey;

    @Column(name = "document_sha256", length = 64)
    private String documentSha256;

    @Column(name = "document_size")
    private Long documentSize;

    @Column(name = "reported_at")
    private Instant reportedAt;

    @Column(name = "created_by_id", nullable = false, length = 128, updatable = false)
    private String createdById;

    @Column(name = "reported_by_id", length = 128)
    private String reportedById;

    @Column(name = "approved_by_id", length = 128)
    private String approvedById;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ReportVersion() {}

    public ReportVersion(UUID sampleId, int version, Map<String, Object> dataSnapshot, String renderedSnapshot, String createdById) {
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive");
        }
        this.sampleId = Objects.requireNonNull(sampleId, "sampleId");
        this.version = version;
        this.dataSnapshot = new LinkedHashMap<>(Objects.requireNonNull(dataSnapshot, "dataSnapshot"));
        this.renderedSnapshot = Objects.requireNonNull(renderedSnapshot, "renderedSnapshot");
        this.createdById = Objects.requireNonNull(createdById, "createdById");
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PreRemove
    void rejectRemoval() {
        throw new IllegalStateException("Report versions are never deleted");
    }

    /**
     * Record the stored document. A version points at exactly one document for its whole life.
     */
    public void attachDocument(String key, String sha256, long size) {
        Objects.requireNonNull(key, "key");
        if (this.documentKey != null) {
            throw new IllegalStateException("Report version " + version + " already references document " + documentKey);
        }
        this.documentKey = key;
        this.documentSha256 = sha256;
        this.documentSize = size;
    }

    public void markFinal(String reporterId, Instant at) {
        this.status = ReportStatus.FINAL;
        this.reportedById = reporterId;
        this.reportedAt = at;
    }

    public void markSuperseded() {
        this.status = ReportStatus.SUPERSEDED;
    }

    public void markApproved(String approverId, Instant at) {
        if (this.approvedById != null) {
            throw new IllegalStateException("Report version " + version + " is already approved");
        }
        this.approvedById = approverId;
        this.approvedAt = at;
    }

    public boolean hasDocument() {
        return documentKey != null;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getSampleId() {
        return sampleId;
    }

    public int getVersion() {
        return version;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public Map<String, Object> getDataSnapshot() {
        return Collections.unmodifiableMap(dataSnapshot);
    }

    public String getRenderedSnapshot() {
        return renderedSnapshot;
    }

    public String getDocumentKey() {
        return documentKey;
    }

    public String getDocumentSha256() {
        return documentSha256;
    }

    public Long getDocumentSize() {
        return documentSize;
    }

    public Instant getReportedAt() {
        return reportedAt;
    }

    public String getCreatedById() {
        return createdById;
    }

    public String getReportedById() {
        return reportedById;
    }

    public String getApprovedById() {
        return approvedById;
    }

    public Instant getApprovedAt() {
        return approvedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportVersion)) {
            return false;
        }
        return id != null && id.equals(((ReportVersion) o).id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "ReportVersion{id=" + id + ", sampleId=" + sampleId + ", version=" + version + ", status=" + status + "}";
    }
}
