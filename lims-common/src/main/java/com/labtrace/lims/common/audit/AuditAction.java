package com.labtrace.lims.common.audit;

/**
 * Kind of mutation recorded in the audit ledger.
 */
public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
}
