package com.labtrace.lims.common.security.policy;

/**
 * Outcome of an authorization check; {@code reason} is set when access is denied.
 */
public record AccessDecision(boolean allowed, String reason) {
    private static final AccessDecision ALLOW = new AccessDecision(true, null);

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, reason);
    }
}
