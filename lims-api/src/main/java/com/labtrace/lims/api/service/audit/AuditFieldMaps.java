package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.api.domain.ReportVersion;
import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.domain.TestAssignment;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field maps handed to the ledger for each audited record kind. Relations appear as ids only.
 */
public final class AuditFieldMaps {

    public static final String SAMPLE = "Sample";
    public static final String TEST_ASSIGNMENT = "TestAssignment";
    public static final String REPORT_VERSION = "ReportVersion";

    private AuditFieldMaps() {}

    public static Map<String, Object> sample(Sample sample) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", sample.getId());
        fields.put("sampleCode", sample.getSampleCode());
        fields.put("jobId", sample.getJob() != null ? sample.getJob().getId() : null);
        fields.put("clientId", sample.getClient() != null ? sample.getClient().getId() : null);
        fields.put("dateReceived", sample.getDateReceived());
        fields.put("dateDue", sample.getDateDue());
        fields.put("rmSupplier", sample.getRmSupplier());
        fields.put("sampleDescription", sample.getSampleDescription());
        fields.put("uinCode", sample.getUinCode());
        fields.put("sampleBatch", sample.getSampleBatch());
        fields.put("temperature", sample.getTemperature());
        fields.put("storageConditions", sample.getStorageConditions());
        fields.put("comments", sample.getComments());
        fields.put("expiredRawMaterial", sample.isExpiredRawMaterial());
        fields.put("postIrradiatedRawMaterial", sample.isPostIrradiatedRawMaterial());
        fields.put("stabilityStudy", sample.isStabilityStudy());
        fields.put("urgent", sample.isUrgent());
        fields.put("allMicroTestsAssigned", sample.isAllMicroTestsAssigned());
        fields.put("allChemistryTestsAssigned", sample.isAllChemistryTestsAssigned());
        fields.put("released", sample.isReleased());
        fields.put("retest", sample.isRetest());
        fields.put("releaseDate", sample.getReleaseDate());
        fields.put("createdDate", sample.getCreatedDate());
        fields.put("lastModifiedDate", sample.getLastModifiedDate());
        return fields;
    }

    public static Map<String, Object> testAssignment(TestAssignment assignment) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", assignment.getId());
        fields.put("sampleId", assignment.getSample() != null ? assignment.getSample().getId() : null);
        fields.put("sectionId", assignment.getSection() != null ? assignment.getSection().getId() : null);
        fields.put("methodId", assignment.getMethod() != null ? assignment.getMethod().getId() : null);
        fields.put("specificationId", assignment.getSpecification() != null ? assignment.getSpecification().getId() : null);
        fields.put("testDefinitionId", assignment.getTestDefinition() != null ? assignment.getTestDefinition().getId() : null);
        fields.put("customTestName", assignment.getCustomTestName());
        fields.put("dueDate", assignment.getDueDate());
        fields.put("status", assignment.getStatus());
        fields.put("testDate", assignment.getTestDate());
        fields.put("result", assignment.getResult());
        fields.put("resultUnit", assignment.getResultUnit());
        fields.put("oos", assignment.isOos());
        fields.put("comments", assignment.getComments());
        fields.put("analyst", assignment.getAnalyst());
        fields.put("checkedBy", assignment.getCheckedBy());
        fields.put("checkedDate", assignment.getCheckedDate());
        fields.put("createdDate", assignment.getCreatedDate());
        fields.put("lastModifiedDate", assignment.getLastModifiedDate());
        return fields;
    }

    /**
     * Report version header. The snapshot and rendered markup are referenced by the version itself, not copied into
     * the ledger.
     */
    public static Map<String, Object> reportVersion(ReportVersion version) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", version.getId());
        fields.put("sampleId", version.getSampleId());
        fields.put("version", version.getVersion());
        fields.put("status", version.getStatus());
        fields.put("documentKey", version.getDocumentKey());
        fields.put("documentSha256", version.getDocumentSha256());
        fields.put("reportedAt", version.getReportedAt());
        fields.put("reportedById", version.getReportedById());
        fields.put("approvedById", version.getApprovedById());
        fields.put("approvedAt", version.getApprovedAt());
        fields.put("createdById", version.getCreatedById());
        fields.put("createdDate", version.getCreatedAt());
        return fields;
    }
}
