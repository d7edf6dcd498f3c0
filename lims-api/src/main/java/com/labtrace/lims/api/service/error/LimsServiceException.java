package com.labtrace.lims.api.service.error;

/**
 * Base of the typed failures raised by the audit and report services.
 */
public abstract class LimsServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected LimsServiceException(String message) {
        super(message);
    }

    protected LimsServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
