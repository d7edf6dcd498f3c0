package com.labtrace.lims.api.web.rest;

import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.lab.RecordResultRequest;
import com.labtrace.lims.api.service.lab.TestAssignmentService;
import com.labtrace.lims.api.service.lab.TestAssignmentView;
import com.labtrace.lims.api.web.filter.AuditContextFilter;
import com.labtrace.lims.api.web.rest.api.ApiResponse;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/test-assignments")
public class TestAssignmentResource {

    private final TestAssignmentService testAssignmentService;
    private final LabAccessGuard accessGuard;

    public TestAssignmentResource(TestAssignmentService testAssignmentService, LabAccessGuard accessGuard) {
        this.testAssignmentService = testAssignmentService;
        this.accessGuard = accessGuard;
    }

    @PutMapping("/{id}/result")
    public ResponseEntity<ApiResponse<TestAssignmentView>> recordResult(
        @PathVariable UUID id,
        @Valid @RequestBody RecordResultRequest request,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.EDIT_RESULTS, LabResource.TEST_ASSIGNMENT);
        TestAssignmentView view = testAssignmentService.recordResult(id, request, RequestContexts.require(context));
        return ResponseEntity.ok(ApiResponse.ok(view, view.oosMessage()));
    }

    @PutMapping("/{id}/review")
    public ResponseEntity<ApiResponse<TestAssignmentView>> review(
        @PathVariable UUID id,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.APPROVE, LabResource.TEST_ASSIGNMENT);
        TestAssignmentView view = testAssignmentService.reviewTestAssignment(id, RequestContexts.require(context));
        return ResponseEntity.ok(ApiResponse.ok(view, "Test assignment reviewed"));
    }

    @PutMapping("/{id}/release")
    public ResponseEntity<ApiResponse<TestAssignmentView>> release(
        @PathVariable UUID id,
        @RequestAttribute(value = AuditContextFilter.CONTEXT_ATTRIBUTE, required = false) AuditContext context
    ) {
        accessGuard.check(LabAction.APPROVE, LabResource.TEST_ASSIGNMENT);
        TestAssignmentView view = testAssignmentService.releaseTestAssignment(id, RequestContexts.require(context));
        return ResponseEntity.ok(ApiResponse.ok(view, "Test assignment released"));
    }
}
