package com.labtrace.lims.api.service.error;

/**
 * Renderer, document converter or object store failed. Safe to retry.
 */
public class UpstreamFailureException extends LimsServiceException {

    private static final long serialVersionUID = 1L;

    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UPSTREAM_FAILURE;
    }
}
