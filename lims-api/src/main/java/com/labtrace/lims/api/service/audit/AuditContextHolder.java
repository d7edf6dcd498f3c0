package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.audit.AuditContextMissingException;
import java.util.Optional;

/**
 * Audit context of the request bound to the current thread. Set and cleared by the request filter.
 */
public final class AuditContextHolder {

    private static final ThreadLocal<AuditContext> CURRENT = new ThreadLocal<>();

    private AuditContextHolder() {}

    public static void set(AuditContext context) {
        CURRENT.set(context);
    }

    public static Optional<AuditContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static AuditContext require() {
        AuditContext context = CURRENT.get();
        if (context == null) {
            throw new AuditContextMissingException("No authenticated audit context bound to this request");
        }
        return context.requireAttributable();
    }

    public static void clear() {
        CURRENT.remove();
    }
}
