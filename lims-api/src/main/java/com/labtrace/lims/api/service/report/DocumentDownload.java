package com.labtrace.lims.api.service.report;

import java.util.UUID;

public record DocumentDownload(UUID versionId, String fileName, String contentType, byte[] content) {}
