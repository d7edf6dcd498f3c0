package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditContext;

/**
 * Hands the audit context to the database session of the current transaction so storage-level capture can attribute
 * writes it observes. Implementations may throw; callers treat propagation as best-effort.
 */
public interface StorageContextPropagator {
    void propagate(AuditContext context);
}
