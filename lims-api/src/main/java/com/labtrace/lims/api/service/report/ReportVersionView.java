package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.domain.ReportVersion;
import com.labtrace.lims.api.domain.enumeration.ReportStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Listing row for a report version; snapshots are left out.
 */
public record ReportVersionView(
    UUID id,
    UUID sampleId,
    int version,
    ReportStatus status,
    String documentKey,
    Long documentSize,
    String downloadUrl,
    String createdById,
    Instant createdAt,
    String reportedById,
    Instant reportedAt,
    String approvedById,
    Instant approvedAt
) {
    public static ReportVersionView from(ReportVersion version, String downloadUrl) {
        return new ReportVersionView(
            version.getId(),
            version.getSampleId(),
            version.getVersion(),
            version.getStatus(),
            version.getDocumentKey(),
            version.getDocumentSize(),
            version.hasDocument() ? downloadUrl : null,
            version.getCreatedById(),
            version.getCreatedAt(),
            version.getReportedById(),
            version.getReportedAt(),
            version.getApprovedById(),
            version.getApprovedAt()
        );
    }
}
