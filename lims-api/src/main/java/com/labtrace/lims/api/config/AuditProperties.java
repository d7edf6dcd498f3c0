package com.labtrace.lims.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lims.audit")
public class AuditProperties {

    private int defaultPageSize = 50;
    private int maxPageSize = 200;
    private final Capture capture = new Capture();

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public Capture getCapture() {
        return capture;
    }

    /**
     * Propagation of the request's audit context into database session settings read by capture triggers.
     */
    public static class Capture {

        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
