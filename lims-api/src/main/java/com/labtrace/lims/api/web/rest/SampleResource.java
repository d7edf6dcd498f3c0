package com.labtrace.lims.api.web.rest;

import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.lab.SampleService;
import com.labtrace.lims.api.service.lab.SampleUpdateRequest;
import com.labtrace.lims.api.service.lab.SampleView;
import com.labtrace.lims.api.service.lab.TestAssignmentService;
import com.labtrace.lims.api.service.lab.TestAssignmentView;
import com.labtrace.lims.api.web.filter.AuditContextFilter;
import com.labtrace.lims.api.web.rest.api.ApiResponse;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/samples")
public class SampleResource {

    private final SampleService sampleService;
    private final TestAssignmentService testAssignmentService;
    private final LabAccessGuard accessGuard;

    public SampleResource(SampleService sampleService, TestAssignmentService testAssignmentService, LabAccessGuard accessGuard) {
        this.sampleService = sampleService;
        this.testAssignmentService = testAssignmentService;
        this.accessGuard = accessGuard;
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<SampleView>> update(
        @PathVariable UUID id,
        @Valid @RequestBody SampleUpdateRequest request,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.UPDATE, LabResource.SAMPLE);
        return ResponseEntity.ok(ApiResponse.ok(sampleService.updateSample(id, request, RequestContexts.require(context))));
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<ApiResponse<SampleView>> release(
        @PathVariable UUID id,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.APPROVE, LabResource.SAMPLE);
        return ResponseEntity.ok(ApiResponse.ok(sampleService.releaseSample(id, RequestContexts.require(context))));
    }

    @PostMapping("/{id}/test-packs/{packId}")
    public ResponseEntity<ApiResponse<List<TestAssignmentView>>> applyTestPack(
        @PathVariable UUID id,
        @PathVariable UUID packId,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.ASSIGN, LabResource.TEST_ASSIGNMENT);
        List<TestAssignmentView> created = testAssignmentService.applyTestPack(id, packId, RequestContexts.require(context));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }
}
