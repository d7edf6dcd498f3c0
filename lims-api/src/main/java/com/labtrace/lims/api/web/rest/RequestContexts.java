package com.labtrace.lims.api.web.rest;

import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.audit.AuditContextMissingException;

final class RequestContexts {

    private RequestContexts() {}

    static AuditContext require(AuditContext context) {
        if (context == null) {
            throw new AuditContextMissingException("An authenticated user with subject and email is required");
        }
        return context.requireAttributable();
    }
}
