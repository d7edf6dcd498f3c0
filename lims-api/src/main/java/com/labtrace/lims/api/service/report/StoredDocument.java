package com.labtrace.lims.api.service.report;

/**
 * @param key storage key, never reused
 * @param size byte length
 * @param sha256 lowercase hex digest of the stored bytes
 */
public record StoredDocument(String key, long size, String sha256) {}
