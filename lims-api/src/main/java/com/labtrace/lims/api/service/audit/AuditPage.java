package com.labtrace.lims.api.service.audit;

import java.util.List;

/**
 * One page of ledger results. {@code total} always counts individual entries, also for grouped pages.
 */
public record AuditPage<T>(List<T> content, long total, int page, int size) {
    public int totalPages() {
        return size == 0 ? 1 : (int) Math.ceil((double) total / (double) size);
    }
}
