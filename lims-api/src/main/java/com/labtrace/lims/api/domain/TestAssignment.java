package com.labtrace.lims.api.domain;

import com.labtrace.lims.api.domain.enumeration.TestAssignmentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;

/**
 * One test performed on a sample, with its result and out-of-specification flag.
 */
@Entity
@Table(name = "test_assignment")
public class TestAssignment extends AbstractAuditingEntity<UUID> implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sample_id", nullable = false)
    private Sample sample;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "section_id", nullable = false)
    private Section section;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "method_id", nullable = false)
    private TestMethod method;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "specification_id")
    private Specification specification;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "test_definition_id")
    private TestDefinition testDefinition;

    @Column(name = "custom_test_name", length = 255)
    private String customTestName;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TestAssignmentStatus status = TestAssignmentStatus.DRAFT;

    @Column(name = "test_date")
    private Instant testDate;

    @Column(name = "result", length = 255)
    private String result;

    @Column(name = "result_unit", length = 32)
    private String resultUnit;

    @Column(name = "oos", nullable = false)
    private boolean oos;

    @Column(name = "comments", length = 2048)
    private String comments;

    @Column(name = "analyst", length = 255)
    private String analyst;

    @Column(name = "checked_by", length = 255)
    private String checkedBy;

    @Column(name = "checked_date")
    private Instant checkedDate;

    /**
     * Custom name when set, else the name of the test definition.
     */
    public String getDisplayName() {
        if (StringUtils.isNotBlank(customTestName)) {
            return customTestName;
        }
        return testDefinition != null ? testDefinition.getName() : null;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Sample getSample() {
        return sample;
    }

    public void setSample(Sample sample) {
        this.sample = sample;
    }

    public Section getSection() {
        return section;
    }

    public void setSection(Section section) {
        this.section = section;
    }

    public TestMethod getMethod() {
        return method;
    }

    public void setMethod(TestMethod method) {
        this.method = method;
    }

    public Specification getSpecification() {
        return specification;
    }

    public void setSpecification(Specification specification) {
        this.specification = specification;
    }

    public TestDefinition getTestDefinition() {
        return testDefinition;
    }

    public void setTestDefinition(TestDefinition testDefinition) {
        this.testDefinition = testDefinition;
    }

    public String getCustomTestName() {
        return customTestName;
    }

    public void setCustomTestName(String customTestName) {
        this.customTestName = customTestName;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public TestAssignmentStatus getStatus() {
        return status;
    }

    public void setStatus(TestAssignmentStatus status) {
        this.status = status;
    }

    public Instant getTestDate() {
        return testDate;
    }

    public void setTestDate(Instant testDate) {
        this.testDate = testDate;
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public String getResultUnit() {
        return resultUnit;
    }

    public void setResultUnit(String resultUnit) {
        this.resultUnit = resultUnit;
    }

    public boolean isOos() {
        return oos;
    }

    public void setOos(boolean oos) {
        this.oos = oos;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public String getAnalyst() {
        return analyst;
    }

    public void setAnalyst(String analyst) {
        this.analyst = analyst;
    }

    public String getCheckedBy() {
        return checkedBy;
    }

    public void setCheckedBy(String checkedBy) {
        this.checkedBy = checkedBy;
    }

    public Instant getCheckedDate() {
        return checkedDate;
    }

    public void setCheckedDate(Instant checkedDate) {
        this.checkedDate = checkedDate;
    }
}
