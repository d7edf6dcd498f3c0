package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditContext;

/**
 * Used when storage-level capture is disabled; all attribution goes through the explicit ledger API.
 */
public class NoopStorageContextPropagator implements StorageContextPropagator {

    @Override
    public void propagate(AuditContext context) {
        // capture disabled
    }
}
