package com.labtrace.lims.api.service.lab;

import com.labtrace.lims.api.domain.Sample;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record SampleView(
    UUID id,
    String sampleCode,
    UUID jobId,
    UUID clientId,
    LocalDate dateReceived,
    LocalDate dateDue,
    String sampleDescription,
    String sampleBatch,
    BigDecimal temperature,
    String storageConditions,
    String comments,
    boolean urgent,
    boolean released,
    Instant releaseDate,
    Instant lastModifiedDate
) {
    public static SampleView from(Sample sample) {
        return new SampleView(
            sample.getId(),
            sample.getSampleCode(),
            sample.getJob() != null ? sample.getJob().getId() : null,
            sample.getClient() != null ? sample.getClient().getId() : null,
            sample.getDateReceived(),
            sample.getDateDue(),
            sample.getSampleDescription(),
            sample.getSampleBatch(),
            sample.getTemperature(),
            sample.getStorageConditions(),
            sample.getComments(),
            sample.isUrgent(),
            sample.isReleased(),
            sample.getReleaseDate(),
            sample.getLastModifiedDate()
        );
    }
}
