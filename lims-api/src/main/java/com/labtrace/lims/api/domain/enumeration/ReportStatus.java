package com.labtrace.lims.api.domain.enumeration;

/**
 * Lifecycle of a certificate report version: DRAFT, then FINAL, then SUPERSEDED once a newer version becomes final.
 */
public enum ReportStatus {
    DRAFT,
    FINAL,
    SUPERSEDED,
}
