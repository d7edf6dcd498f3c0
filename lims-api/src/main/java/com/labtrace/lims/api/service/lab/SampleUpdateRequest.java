package com.labtrace.lims.api.service.lab;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of a sample; {@code null} leaves a field unchanged.
 */
public record SampleUpdateRequest(
    LocalDate dateDue,
    @Size(max = 255) String rmSupplier,
    @Size(max = 1024) String sampleDescription,
    @Size(max = 64) String uinCode,
    @Size(max = 64) String sampleBatch,
    BigDecimal temperature,
    @Size(max = 255) String storageConditions,
    @Size(max = 2048) String comments,
    Boolean expiredRawMaterial,
    Boolean postIrradiatedRawMaterial,
    Boolean stabilityStudy,
    Boolean urgent,
    Boolean allMicroTestsAssigned,
    Boolean allChemistryTestsAssigned,
    Boolean retest
) {}
