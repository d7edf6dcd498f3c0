package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.config.ReportProperties;
import com.labtrace.lims.api.domain.Client;
import com.labtrace.lims.api.domain.Job;
import com.labtrace.lims.api.domain.LabSettings;
import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.domain.Specification;
import com.labtrace.lims.api.domain.TestAssignment;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.audit.ChangeDiffEngine;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Copies the current state of a sample, its tests and the lab settings into a {@link ReportSnapshot}.
 * Must run while the sample's relations are loadable.
 */
@Component
public class ReportSnapshotFactory {

    public static final String SAMPLE = "sample";
    public static final String CLIENT = "client";
    public static final String JOB = "job";
    public static final String STATUS_FLAGS = "statusFlags";
    public static final String TESTS = "tests";
    public static final String METADATA = "reportMetadata";
    public static final String TEMPLATE_SETTINGS = "templateSettings";

    private final ReportProperties properties;

    public ReportSnapshotFactory(ReportProperties properties) {
        this.properties = properties;
    }

    public ReportSnapshot build(Sample sample, int version, AuditContext context, LabSettings settings) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(SAMPLE, sampleSection(sample));
        data.put(CLIENT, clientSection(sample.getClient()));
        data.put(JOB, jobSection(sample.getJob()));
        data.put(STATUS_FLAGS, statusFlags(sample));
        List<Object> tests = new ArrayList<>();
        for (TestAssignment assignment : sample.getTestAssignments()) {
            tests.add(testRow(assignment));
        }
        data.put(TESTS, tests);
        data.put(METADATA, metadata(version, context, settings));
        @SuppressWarnings("unchecked")
        Map<String, Object> normalized = (Map<String, Object>) ChangeDiffEngine.normalizeValue(data);
        return new ReportSnapshot(version, normalized);
    }

    private static Map<String, Object> sampleSection(Sample sample) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("id", sample.getId());
        section.put("sampleCode", sample.getSampleCode());
        section.put("dateReceived", sample.getDateReceived());
        section.put("dateDue", sample.getDateDue());
        section.put("rmSupplier", sample.getRmSupplier());
        section.put("sampleDescription", sample.getSampleDescription());
        section.put("uinCode", sample.getUinCode());
        section.put("sampleBatch", sample.getSampleBatch());
        section.put("temperature", sample.getTemperature());
        section.put("storageConditions", sample.getStorageConditions());
        section.put("comments", sample.getComments());
        section.put("releaseDate", sample.getReleaseDate());
        return section;
    }

    private static Map<String, Object> clientSection(Client client) {
        if (client == null) {
            return null;
        }
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("id", client.getId());
        section.put("name", client.getName());
        section.put("contactName", client.getContactName());
        section.put("email", client.getEmail());
        section.put("phone", client.getPhone());
        section.put("address", client.getAddress());
        return section;
    }

    private static Map<String, Object> jobSection(Job job) {
        if (job == null) {
            return null;
        }
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("id", job.getId());
        section.put("jobNumber", job.getJobNumber());
        section.put("needByDate", job.getNeedByDate());
        section.put("quoteNumber", job.getQuoteNumber());
        section.put("poNumber", job.getPoNumber());
        return section;
    }

    private static Map<String, Object> statusFlags(Sample sample) {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("expiredRawMaterial", sample.isExpiredRawMaterial());
        flags.put("postIrradiatedRawMaterial", sample.isPostIrradiatedRawMaterial());
        flags.put("stabilityStudy", sample.isStabilityStudy());
        flags.put("urgent", sample.isUrgent());
        flags.put("allMicroTestsAssigned", sample.isAllMicroTestsAssigned());
        flags.put("allChemistryTestsAssigned", sample.isAllChemistryTestsAssigned());
        flags.put("released", sample.isReleased());
        flags.put("retest", sample.isRetest());
        return flags;
    }

    private static Map<String, Object> testRow(TestAssignment assignment) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", assignment.getId());
        row.put("section", assignment.getSection() != null ? assignment.getSection().getName() : null);
        row.put("test", assignment.getDisplayName());
        row.put("method", assignment.getMethod() != null ? assignment.getMethod().getName() : null);
        row.put("specification", specification(assignment.getSpecification()));
        row.put("result", assignment.getResult());
        row.put("unit", assignment.getResultUnit());
        row.put("status", assignment.getStatus());
        row.put("dueDate", assignment.getDueDate());
        row.put("testDate", assignment.getTestDate());
        row.put("analyst", assignment.getAnalyst());
        row.put("checkedBy", assignment.getCheckedBy());
        row.put("checkedDate", assignment.getCheckedDate());
        row.put("oos", assignment.isOos());
        row.put("comments", assignment.getComments());
        return row;
    }

    private static Map<String, Object> specification(Specification specification) {
        if (specification == null) {
            return null;
        }
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("code", specification.getCode());
        spec.put("name", specification.getName());
        spec.put("target", specification.getTarget());
        spec.put("min", specification.getMin());
        spec.put("max", specification.getMax());
        spec.put("unit", specification.getUnit());
        spec.put("comparator", specification.getComparator());
        spec.put("threshold", specification.getThreshold());
        return spec;
    }

    private Map<String, Object> metadata(int version, AuditContext context, LabSettings settings) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", version);
        metadata.put("generatedAt", Instant.now());
        metadata.put("generatedBy", context != null ? context.actorEmail() : null);
        String labName = settings != null ? settings.getLabName() : null;
        String disclaimer = settings != null ? settings.getDisclaimerText() : null;
        metadata.put("labName", StringUtils.defaultIfBlank(labName, properties.getLabName()));
        metadata.put("labLogoUrl", settings != null ? settings.getLabLogoUrl() : null);
        metadata.put("disclaimer", StringUtils.defaultIfBlank(disclaimer, properties.getDisclaimer()));
        Map<String, Object> template = settings != null && settings.getTemplateSettings() != null ? settings.getTemplateSettings() : Map.of();
        metadata.put(TEMPLATE_SETTINGS, template);
        return metadata;
    }
}
