package com.labtrace.lims.common.audit;

import org.apache.commons.lang3.StringUtils;

/**
 * Who performed a mutation and from where. Carried explicitly into every ledger write and report operation.
 *
 * @param actorId stable subject identifier of the caller
 * @param actorEmail email of the caller
 * @param ip client address, {@link #UNKNOWN_IP} when it could not be determined
 * @param userAgent declared client agent, {@link #UNKNOWN_AGENT} when absent
 * @param transactionTag optional tag grouping the entries of one multi-record operation
 */
public record AuditContext(String actorId, String actorEmail, String ip, String userAgent, String transactionTag) {

    public static final String UNKNOWN_IP = "127.0.0.1";
    public static final String UNKNOWN_AGENT = "unknown";

    public AuditContext {
        actorId = StringUtils.trimToNull(actorId);
        actorEmail = StringUtils.trimToNull(actorEmail);
        ip = StringUtils.defaultIfBlank(StringUtils.trim(ip), UNKNOWN_IP);
        userAgent = StringUtils.defaultIfBlank(StringUtils.trim(userAgent), UNKNOWN_AGENT);
        transactionTag = StringUtils.trimToNull(transactionTag);
    }

    public static AuditContext of(String actorId, String actorEmail, String ip, String userAgent) {
        return new AuditContext(actorId, actorEmail, ip, userAgent, null);
    }

    public AuditContext withTransactionTag(String tag) {
        return new AuditContext(actorId, actorEmail, ip, userAgent, tag);
    }

    /**
     * @return true when both actor id and email are present.
     */
    public boolean isAttributable() {
        return actorId != null && actorEmail != null;
    }

    public AuditContext requireAttributable() {
        if (!isAttributable()) {
            throw new AuditContextMissingException("Audit context requires actor id and email");
        }
        return this;
    }
}
