package com.labtrace.lims.api.service.report;

/**
 * Turns a snapshot into printable markup. Implementations must be deterministic for a given snapshot.
 */
public interface ReportRenderer {
    String render(ReportSnapshot snapshot);
}
