package com.labtrace.lims.api.web.rest;

import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.audit.AuditEntryQueryService;
import com.labtrace.lims.api.service.audit.AuditEntryView;
import com.labtrace.lims.api.service.audit.AuditSearchCriteria;
import com.labtrace.lims.api.web.rest.api.ApiResponse;
import com.labtrace.lims.api.web.rest.vm.PagedResultVM;
import com.labtrace.lims.common.audit.AuditAction;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import java.time.Instant;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the audit ledger. No write mappings exist; PUT, PATCH and DELETE answer 405.
 */
@RestController
@RequestMapping("/api/audit")
public class AuditTrailResource {

    private final AuditEntryQueryService queryService;
    private final LabAccessGuard accessGuard;

    public AuditTrailResource(AuditEntryQueryService queryService, LabAccessGuard accessGuard) {
        this.queryService = queryService;
        this.accessGuard = accessGuard;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResultVM<?>>> list(
        @RequestParam(value = "subjectType", required = false) String subjectType,
        @RequestParam(value = "subjectId", required = false) String subjectId,
        @RequestParam(value = "actorId", required = false) String actorId,
        @RequestParam(value = "action", required = false) AuditAction action,
        @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
        @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
        @RequestParam(value = "transactionTag", required = false) String transactionTag,
        @RequestParam(value = "page", defaultValue = "0") int page,
        @RequestParam(value = "size", defaultValue = "0") int size,
        @RequestParam(value = "grouped", defaultValue = "false") boolean grouped
    ) {
        accessGuard.check(LabAction.READ, LabResource.AUDIT_LOG);
        AuditSearchCriteria criteria = new AuditSearchCriteria(subjectType, subjectId, actorId, action, from, to, transactionTag);
        PagedResultVM<?> result = grouped
            ? PagedResultVM.of(queryService.queryGrouped(criteria, page, size))
            : PagedResultVM.of(queryService.query(criteria, page, size));
        return ResponseEntity.ok(ApiResponse.ok(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<AuditEntryView>> detail(@PathVariable UUID id) {
        accessGuard.check(LabAction.READ, LabResource.AUDIT_LOG);
        return ResponseEntity.ok(ApiResponse.ok(queryService.getById(id)));
    }
}
