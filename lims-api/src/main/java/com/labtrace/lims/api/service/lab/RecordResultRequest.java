package com.labtrace.lims.api.service.lab;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * @param testDate defaults to now
 */
public record RecordResultRequest(
    @NotBlank @Size(max = 255) String result,
    @Size(max = 32) String resultUnit,
    Instant testDate,
    @Size(max = 255) String analyst,
    @Size(max = 2048) String comments
) {}
