package com.labtrace.lims.api.service.lab;

import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.domain.TestAssignment;
import com.labtrace.lims.api.domain.TestDefinition;
import com.labtrace.lims.api.domain.TestPack;
import com.labtrace.lims.api.domain.enumeration.TestAssignmentStatus;
import com.labtrace.lims.api.repository.SampleRepository;
import com.labtrace.lims.api.repository.TestAssignmentRepository;
import com.labtrace.lims.api.repository.TestPackRepository;
import com.labtrace.lims.api.service.audit.AuditFieldMaps;
import com.labtrace.lims.api.service.audit.AuditTrailService;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.api.service.error.WorkflowStateException;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.quality.OosEvaluator;
import com.labtrace.lims.common.quality.OosVerdict;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TestAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(TestAssignmentService.class);

    private final SampleRepository sampleRepository;
    private final TestPackRepository testPackRepository;
    private final TestAssignmentRepository testAssignmentRepository;
    private final AuditTrailService auditTrailService;
    private final Clock clock;

    @Autowired
    public TestAssignmentService(
        SampleRepository sampleRepository,
        TestPackRepository testPackRepository,
        TestAssignmentRepository testAssignmentRepository,
        AuditTrailService auditTrailService
    ) {
        this(sampleRepository, testPackRepository, testAssignmentRepository, auditTrailService, Clock.systemUTC());
    }

    TestAssignmentService(
        SampleRepository sampleRepository,
        TestPackRepository testPackRepository,
        TestAssignmentRepository testAssignmentRepository,
        AuditTrailService auditTrailService,
        Clock clock
    ) {
        this.sampleRepository = sampleRepository;
        this.testPackRepository = testPackRepository;
        this.testAssignmentRepository = testAssignmentRepository;
        this.auditTrailService = auditTrailService;
        this.clock = clock;
    }

    /**
     * Creates one DRAFT assignment per test definition of the pack, in pack order. All audit entries of the call share
     * one transaction tag.
     */
    public List<TestAssignmentView> applyTestPack(UUID sampleId, UUID testPackId, AuditContext context) {
        Objects.requireNonNull(context, "context").requireAttributable();
        Sample sample = sampleRepository.findById(sampleId).orElseThrow(() -> new RecordNotFoundException("Sample", sampleId));
        TestPack pack = testPackRepository
            .findWithDefinitionsById(testPackId)
            .orElseThrow(() -> new RecordNotFoundException("Test pack", testPackId));

        AuditContext tagged = context.withTransactionTag(auditTrailService.generateTransactionTag());
        List<TestAssignmentView> created = new ArrayList<>(pack.getDefinitions().size());
        for (TestDefinition definition : pack.getDefinitions()) {
            TestAssignment assignment = new TestAssignment();
            assignment.setSample(sample);
            assignment.setTestDefinition(definition);
            assignment.setSection(definition.getSection());
            assignment.setMethod(definition.getMethod());
            assignment.setSpecification(definition.getSpecification());
            assignment.setStatus(TestAssignmentStatus.DRAFT);
            if (definition.getDefaultDueDays() != null) {
                assignment.setDueDate(LocalDate.now(clock).plusDays(definition.getDefaultDueDays()));
            }
            TestAssignment saved = testAssignmentRepository.saveAndFlush(assignment);
            auditTrailService.logCreate(tagged, AuditFieldMaps.TEST_ASSIGNMENT, saved.getId(), AuditFieldMaps.testAssignment(saved));
            created.add(TestAssignmentView.from(saved, null));
        }
        log.info("Applied test pack {} to sample {}: {} assignments, tag {}", pack.getName(), sample.getSampleCode(), created.size(), tagged.transactionTag());
        return created;
    }

    /**
     * Stores a result, flags it against the assignment's specification and marks the assignment COMPLETED.
     */
    public TestAssignmentView recordResult(UUID assignmentId, RecordResultRequest request, AuditContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context").requireAttributable();
        TestAssignment assignment = findAssignment(assignmentId);
        Map<String, Object> before = AuditFieldMaps.testAssignment(assignment);

        OosVerdict verdict = OosEvaluator.evaluate(
            request.result(),
            assignment.getSpecification() != null ? assignment.getSpecification().toRule() : null
        );
        assignment.setResult(request.result());
        assignment.setResultUnit(request.resultUnit());
        assignment.setTestDate(request.testDate() != null ? request.testDate() : Instant.now(clock));
        assignment.setOos(verdict.outOfSpecification());
        assignment.setStatus(TestAssignmentStatus.COMPLETED);
        assignment.setAnalyst(StringUtils.defaultIfBlank(request.analyst(), context.actorEmail()));
        if (request.comments() != null) {
            assignment.setComments(request.comments());
        }

        TestAssignment saved = testAssignmentRepository.saveAndFlush(assignment);
        auditTrailService.logUpdate(context, AuditFieldMaps.TEST_ASSIGNMENT, saved.getId(), before, AuditFieldMaps.testAssignment(saved));
        if (verdict.outOfSpecification()) {
            log.warn("OOS result on test assignment {}: {}", saved.getId(), verdict.message());
        }
        return TestAssignmentView.from(saved, verdict.message());
    }

    /**
     * Checker sign-off: a COMPLETED assignment becomes REVIEWED and is stamped with the checker and the check date.
     */
    public TestAssignmentView reviewTestAssignment(UUID assignmentId, AuditContext context) {
        Objects.requireNonNull(context, "context").requireAttributable();
        TestAssignment assignment = findAssignment(assignmentId);
        if (assignment.getStatus() != TestAssignmentStatus.COMPLETED) {
            throw new WorkflowStateException("Test assignment must be COMPLETED before it can be reviewed");
        }
        Map<String, Object> before = AuditFieldMaps.testAssignment(assignment);
        assignment.setStatus(TestAssignmentStatus.REVIEWED);
        assignment.setCheckedBy(context.actorEmail());
        assignment.setCheckedDate(Instant.now(clock));

        TestAssignment saved = testAssignmentRepository.saveAndFlush(assignment);
        auditTrailService.logUpdate(context, AuditFieldMaps.TEST_ASSIGNMENT, saved.getId(), before, AuditFieldMaps.testAssignment(saved));
        log.debug("Test assignment {} reviewed by {}", saved.getId(), context.actorEmail());
        return TestAssignmentView.from(saved, null);
    }

    public TestAssignmentView releaseTestAssignment(UUID assignmentId, AuditContext context) {
        Objects.requireNonNull(context, "context").requireAttributable();
        TestAssignment assignment = findAssignment(assignmentId);
        if (assignment.getStatus() != TestAssignmentStatus.REVIEWED) {
            throw new WorkflowStateException("Test assignment must be REVIEWED before it can be released");
        }
        Map<String, Object> before = AuditFieldMaps.testAssignment(assignment);
        assignment.setStatus(TestAssignmentStatus.RELEASED);

        TestAssignment saved = testAssignmentRepository.saveAndFlush(assignment);
        auditTrailService.logUpdate(context, AuditFieldMaps.TEST_ASSIGNMENT, saved.getId(), before, AuditFieldMaps.testAssignment(saved));
        log.debug("Test assignment {} released by {}", saved.getId(), context.actorEmail());
        return TestAssignmentView.from(saved, null);
    }

    private TestAssignment findAssignment(UUID assignmentId) {
        return testAssignmentRepository.findById(assignmentId).orElseThrow(() -> new RecordNotFoundException("Test assignment", assignmentId));
    }
}
