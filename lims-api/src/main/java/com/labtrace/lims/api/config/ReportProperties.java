package com.labtrace.lims.api.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Certificate report generation: storage layout, converter endpoint and lab defaults.
 */
@ConfigurationProperties(prefix = "lims.reports")
public class ReportProperties {

    private String storagePrefix = "coa-reports";
    private String downloadPathTemplate = "/api/reports/{id}/download";
    private String labName = "Laboratory LIMS Pro";
    private String disclaimer =
        "This certificate relates only to the sample tested. It shall not be reproduced except in full without written approval of the laboratory.";
    private final Store store = new Store();
    private final Converter converter = new Converter();

    public String getStoragePrefix() {
        return storagePrefix;
    }

    public void setStoragePrefix(String storagePrefix) {
        this.storagePrefix = storagePrefix;
    }

    public String getDownloadPathTemplate() {
        return downloadPathTemplate;
    }

    public void setDownloadPathTemplate(String downloadPathTemplate) {
        this.downloadPathTemplate = downloadPathTemplate;
    }

    public String getLabName() {
        return labName;
    }

    public void setLabName(String labName) {
        this.labName = labName;
    }

    public String getDisclaimer() {
        return disclaimer;
    }

    public void setDisclaimer(String disclaimer) {
        this.disclaimer = disclaimer;
    }

    public Store getStore() {
        return store;
    }

    public Converter getConverter() {
        return converter;
    }

    public static class Store {

        private String rootDir = "./data/documents";

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }
    }

    public static class Converter {

        private String endpoint = "http://localhost:3000/forms/chromium/convert/html";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
        private String paperFormat = "A4";
        private String marginVertical = "20mm";
        private String marginHorizontal = "15mm";
        private boolean printBackground = true;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public String getPaperFormat() {
            return paperFormat;
        }

        public void setPaperFormat(String paperFormat) {
            this.paperFormat = paperFormat;
        }

        public String getMarginVertical() {
            return marginVertical;
        }

        public void setMarginVertical(String marginVertical) {
            this.marginVertical = marginVertical;
        }

        public String getMarginHorizontal() {
            return marginHorizontal;
        }

        public void setMarginHorizontal(String marginHorizontal) {
            this.marginHorizontal = marginHorizontal;
        }

        public boolean isPrintBackground() {
            return printBackground;
        }

        public void setPrintBackground(boolean printBackground) {
            this.printBackground = printBackground;
        }
    }
}
