package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.domain.enumeration.ReportStatus;
import java.util.UUID;

public record ExportResult(UUID id, int version, ReportStatus status, String documentKey, String downloadUrl, String message) {}
