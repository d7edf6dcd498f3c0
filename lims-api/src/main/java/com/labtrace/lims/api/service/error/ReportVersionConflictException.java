package com.labtrace.lims.api.service.error;

/**
 * Lost a version-number race for a sample, or hit another unique key.
 */
public class ReportVersionConflictException extends LimsServiceException {

    private static final long serialVersionUID = 1L;

    public ReportVersionConflictException(String message) {
        super(message);
    }

    public ReportVersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
