package com.labtrace.lims.api.service.report;

import java.util.Map;
import java.util.UUID;

/**
 * What an export would produce right now. Nothing is persisted for a preview.
 */
public record PreviewResult(UUID sampleId, String sampleCode, int version, Map<String, Object> dataSnapshot, String renderedSnapshot) {}
