package com.labtrace.lims.api.service.error;

public class ReportValidationException extends LimsServiceException {

    private static final long serialVersionUID = 1L;

    public ReportValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
