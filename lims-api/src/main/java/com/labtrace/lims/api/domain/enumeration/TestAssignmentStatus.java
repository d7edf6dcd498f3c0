package com.labtrace.lims.api.domain.enumeration;

public enum TestAssignmentStatus {
    DRAFT,
    IN_PROGRESS,
    COMPLETED,
    REVIEWED,
    RELEASED,
}
