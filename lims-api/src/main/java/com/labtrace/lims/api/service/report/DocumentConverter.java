package com.labtrace.lims.api.service.report;

/**
 * Produces the downloadable document (PDF) for rendered markup.
 */
public interface DocumentConverter {
    /**
     * @throws com.labtrace.lims.api.service.error.UpstreamFailureException when the conversion service fails
     */
    byte[] convert(String markup, ConversionOptions options);
}
