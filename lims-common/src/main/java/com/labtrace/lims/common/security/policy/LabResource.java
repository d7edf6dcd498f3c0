package com.labtrace.lims.common.security.policy;

/**
 * Closed set of resource kinds guarded by the laboratory role matrix.
 */
public enum LabResource {
    SAMPLE,
    TEST_ASSIGNMENT,
    REPORT,
    AUDIT_LOG,
    SETTINGS,
}
