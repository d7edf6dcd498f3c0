package com.labtrace.lims.common.security.policy;

public enum LabAction {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    ASSIGN,
    EDIT_RESULTS,
    GENERATE_DRAFT,
    FINALIZE,
    APPROVE,
    EXPORT,
}
