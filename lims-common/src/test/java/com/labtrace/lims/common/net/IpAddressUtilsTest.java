package com.labtrace.lims.common.net;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class IpAddressUtilsTest {

    @Test
    void resolveClientIp_prefersFirstForwardedHop() {
        assertEquals("203.0.113.7", IpAddressUtils.resolveClientIp("203.0.113.7, 10.0.0.2", "10.0.0.1"));
    }

    @Test
    void resolveClientIp_fallsBackToRemoteAddress() {
        assertEquals("10.0.0.1", IpAddressUtils.resolveClientIp(null, "10.0.0.1"));
        assertEquals("10.0.0.1", IpAddressUtils.resolveClientIp(" unknown , ", "10.0.0.1"));
    }

    @Test
    void resolveClientIp_stripsPortsAndBrackets() {
        assertEquals("198.51.100.4", IpAddressUtils.resolveClientIp("198.51.100.4:5544", null));
        assertEquals("2001:db8::1", IpAddressUtils.resolveClientIp("[2001:db8::1]:443", null));
        assertEquals("192.0.2.9", IpAddressUtils.resolveClientIp(null, "::ffff:192.0.2.9"));
    }

    @Test
    void resolveClientIp_returnsNullWithoutCandidates() {
        assertNull(IpAddressUtils.resolveClientIp("", null));
    }
}
