package com.labtrace.lims.api.service.report;

/**
 * Write-once storage for generated documents.
 */
public interface DocumentStore {
    /**
     * Stores {@code content} under a key that must not exist yet.
     *
     * @throws com.labtrace.lims.api.service.error.UpstreamFailureException on storage failure or key reuse
     */
    StoredDocument put(String key, byte[] content, String contentType);

    /**
     * @throws com.labtrace.lims.api.service.error.RecordNotFoundException when nothing is stored under {@code key}
     */
    byte[] get(String key);
}
