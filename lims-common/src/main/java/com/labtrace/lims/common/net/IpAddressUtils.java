package com.labtrace.lims.common.net;

import org.apache.commons.lang3.StringUtils;

/**
 * Client address resolution for request provenance.
 */
public final class IpAddressUtils {

    private IpAddressUtils() {}

    /**
     * Resolve the originating client address: the first hop of {@code X-Forwarded-For} when present, else the
     * transport-level peer address.
     *
     * @return the address, or {@code null} when neither source yields one
     */
    public static String resolveClientIp(String forwardedFor, String remoteAddr) {
        String first = firstForwardedHop(forwardedFor);
        if (first != null) {
            return first;
        }
        return sanitize(remoteAddr);
    }

    public static String firstForwardedHop(String forwardedFor) {
        if (StringUtils.isBlank(forwardedFor)) {
            return null;
        }
        for (String segment : forwardedFor.split(",")) {
            String candidate = sanitize(segment);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    static String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || "unknown".equalsIgnoreCase(trimmed)) {
            return null;
        }
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            trimmed = trimmed.substring(0, space);
        }
        if (trimmed.startsWith("[")) {
            int idx = trimmed.indexOf(']');
            if (idx > 0) {
                trimmed = trimmed.substring(1, idx);
            }
        }
        int colon = trimmed.indexOf(':');
        if (colon > 0 && trimmed.indexOf(':', colon + 1) == -1) {
            trimmed = trimmed.substring(0, colon);
        }
        if (trimmed.startsWith("::ffff:") && trimmed.indexOf('.') > 0) {
            trimmed = trimmed.substring(7);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
