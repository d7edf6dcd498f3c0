package com.labtrace.lims.api.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A sample received by the laboratory. Subject of certificate reports.
 */
@Entity
@Table(name = "sample")
public class Sample extends AbstractAuditingEntity<UUID> implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "sample_code", nullable = false, unique = true, length = 64)
    private String sampleCode;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "job_id", nullable = false)
    private Job job;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @Column(name = "date_received")
    private LocalDate dateReceived;

    @Column(name = "date_due")
    private LocalDate dateDue;

    @Column(name = "rm_supplier", length = 255)
    private String rmSupplier;

    @Column(name = "sample_description", length = 1024)
    private String sampleDescription;

    @Column(name = "uin_code", length = 64)
    private String uinCode;

    @Column(name = "sample_batch", length = 64)
    private String sampleBatch;

    @Column(name = "temperature_on_receipt_c", precision = 5, scale = 2)
    private BigDecimal temperature;

    @Column(name = "storage_conditions", length = 255)
    private String storageConditions;

    @Column(name = "comments", length = 2048)
    private String comments;

    @Column(name = "expired_raw_material", nullable = false)
    private boolean expiredRawMaterial;

    @Column(name = "post_irradiated_raw_material", nullable = false)
    private boolean postIrradiatedRawMaterial;

    @Column(name = "stability_study", nullable = false)
    private boolean stabilityStudy;

    @Column(name = "urgent", nullable = false)
    private boolean urgent;

    @Column(name = "all_micro_tests_assigned", nullable = false)
    private boolean allMicroTestsAssigned;

    @Column(name = "all_chemistry_tests_assigned", nullable = false)
    private boolean allChemistryTestsAssigned;

    @Column(name = "released", nullable = false)
    private boolean released;

    @Column(name = "retest", nullable = false)
    private boolean retest;

    @Column(name = "release_date")
    private Instant releaseDate;

    @OneToMany(mappedBy = "sample", fetch = FetchType.LAZY)
    @OrderBy("createdDate ASC")
    private List<TestAssignment> testAssignments = new ArrayList<>();

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getSampleCode() {
        return sampleCode;
    }

    public void setSampleCode(String sampleCode) {
        this.sampleCode = sampleCode;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Client getClient() {
        return client;
    }

    public void setClient(Client client) {
        this.client = client;
    }

    public LocalDate getDateReceived() {
        return dateReceived;
    }

    public void setDateReceived(LocalDate dateReceived) {
        this.dateReceived = dateReceived;
    }

    public LocalDate getDateDue() {
        return dateDue;
    }

    public void setDateDue(LocalDate dateDue) {
        this.dateDue = dateDue;
    }

    public String getRmSupplier() {
        return rmSupplier;
    }

    public void setRmSupplier(String rmSupplier) {
        this.rmSupplier = rmSupplier;
    }

    public String getSampleDescription() {
        return sampleDescription;
    }

    public void setSampleDescription(String sampleDescription) {
        this.sampleDescription = sampleDescription;
    }

    public String getUinCode() {
        return uinCode;
    }

    public void setUinCode(String uinCode) {
        this.uinCode = uinCode;
    }

    public String getSampleBatch() {
        return sampleBatch;
    }

    public void setSampleBatch(String sampleBatch) {
        this.sampleBatch = sampleBatch;
    }

    public BigDecimal getTemperature() {
        return temperature;
    }

    public void setTemperature(BigDecimal temperature) {
        this.temperature = temperature;
    }

    public String getStorageConditions() {
        return storageConditions;
    }

    public void setStorageConditions(String storageConditions) {
        this.storageConditions = storageConditions;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public boolean isExpiredRawMaterial() {
        return expiredRawMaterial;
    }

    public void setExpiredRawMaterial(boolean expiredRawMaterial) {
        this.expiredRawMaterial = expiredRawMaterial;
    }

    public boolean isPostIrradiatedRawMaterial() {
        return postIrradiatedRawMaterial;
    }

    public void setPostIrradiatedRawMaterial(boolean postIrradiatedRawMaterial) {
        this.postIrradiatedRawMaterial = postIrradiatedRawMaterial;
    }

    public boolean isStabilityStudy() {
        return stabilityStudy;
    }

    public void setStabilityStudy(boolean stabilityStudy) {
        this.stabilityStudy = stabilityStudy;
    }

    public boolean isUrgent() {
        return urgent;
    }

    public void setUrgent(boolean urgent) {
        this.urgent = urgent;
    }

    public boolean isAllMicroTestsAssigned() {
        return allMicroTestsAssigned;
    }

    public void setAllMicroTestsAssigned(boolean allMicroTestsAssigned) {
        this.allMicroTestsAssigned = allMicroTestsAssigned;
    }

    public boolean isAllChemistryTestsAssigned() {
        return allChemistryTestsAssigned;
    }

    public void setAllChemistryTestsAssigned(boolean allChemistryTestsAssigned) {
        this.allChemistryTestsAssigned = allChemistryTestsAssigned;
    }

    public boolean isReleased() {
        return released;
    }

    public void setReleased(boolean released) {
        this.released = released;
    }

    public boolean isRetest() {
        return retest;
    }

    public void setRetest(boolean retest) {
        this.retest = retest;
    }

    public Instant getReleaseDate() {
        return releaseDate;
    }

    public void setReleaseDate(Instant releaseDate) {
        this.releaseDate = releaseDate;
    }

    public List<TestAssignment> getTestAssignments() {
        return testAssignments;
    }

    public void setTestAssignments(List<TestAssignment> testAssignments) {
        this.testAssignments = testAssignments;
    }
}
