package com.labtrace.lims.common.audit;

/**
 * Raised when a ledger write is attempted without an attributable actor.
 */
public class AuditContextMissingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AuditContextMissingException(String message) {
        super(message);
    }
}
