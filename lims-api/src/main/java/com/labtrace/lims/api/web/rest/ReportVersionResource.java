package com.labtrace.lims.api.web.rest;

import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.report.DocumentDownload;
import com.labtrace.lims.api.service.report.ExportResult;
import com.labtrace.lims.api.service.report.PreviewResult;
import com.labtrace.lims.api.service.report.ReportVersionDetail;
import com.labtrace.lims.api.service.report.ReportVersionView;
import com.labtrace.lims.api.service.report.VersionedReportService;
import com.labtrace.lims.api.web.filter.AuditContextFilter;
import com.labtrace.lims.api.web.rest.api.ApiResponse;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ReportVersionResource {

    private final VersionedReportService reportService;
    private final LabAccessGuard accessGuard;

    public ReportVersionResource(VersionedReportService reportService, LabAccessGuard accessGuard) {
        this.reportService = reportService;
        this.accessGuard = accessGuard;
    }

    @PostMapping("/samples/{sampleId}/reports/preview")
    public ResponseEntity<ApiResponse<PreviewResult>> preview(
        @PathVariable UUID sampleId,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.GENERATE_DRAFT, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.previewSnapshot(sampleId, context)));
    }

    @PostMapping("/samples/{sampleId}/reports/export")
    public ResponseEntity<ApiResponse<ExportResult>> export(
        @PathVariable UUID sampleId,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.EXPORT, LabResource.REPORT);
        ExportResult result = reportService.exportVersion(sampleId, RequestContexts.require(context));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result, result.message()));
    }

    @PostMapping("/samples/{sampleId}/reports/draft")
    public ResponseEntity<ApiResponse<ReportVersionView>> draft(
        @PathVariable UUID sampleId,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.GENERATE_DRAFT, LabResource.REPORT);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(reportService.createDraft(sampleId, RequestContexts.require(context))));
    }

    @GetMapping("/samples/{sampleId}/reports")
    public ResponseEntity<ApiResponse<List<ReportVersionView>>> list(@PathVariable UUID sampleId) {
        accessGuard.check(LabAction.READ, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.listVersions(sampleId)));
    }

    @GetMapping("/samples/{sampleId}/reports/latest")
    public ResponseEntity<ApiResponse<ReportVersionView>> latest(@PathVariable UUID sampleId) {
        accessGuard.check(LabAction.READ, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.getLatestVersion(sampleId)));
    }

    @GetMapping("/reports/{id}")
    public ResponseEntity<ApiResponse<ReportVersionDetail>> detail(@PathVariable UUID id) {
        accessGuard.check(LabAction.READ, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.getVersion(id)));
    }

    @PostMapping("/reports/{id}/finalize")
    public ResponseEntity<ApiResponse<ReportVersionView>> finalizeDraft(
        @PathVariable UUID id,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.FINALIZE, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.finalizeDraft(id, RequestContexts.require(context))));
    }

    @PostMapping("/reports/{id}/approve")
    public ResponseEntity<ApiResponse<ReportVersionView>> approve(
        @PathVariable UUID id,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.APPROVE, LabResource.REPORT);
        return ResponseEntity.ok(ApiResponse.ok(reportService.approveVersion(id, RequestContexts.require(context))));
    }

    @GetMapping("/reports/{id}/download")
    public ResponseEntity<byte[]> download(@PathVariable UUID id) {
        accessGuard.check(LabAction.READ, LabResource.REPORT);
        DocumentDownload document = reportService.downloadDocument(id);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(document.contentType()));
        headers.setContentLength(document.content().length);
        headers.setContentDisposition(ContentDisposition.attachment().filename(document.fileName()).build());
        return new ResponseEntity<>(document.content(), headers, HttpStatus.OK);
    }
}
