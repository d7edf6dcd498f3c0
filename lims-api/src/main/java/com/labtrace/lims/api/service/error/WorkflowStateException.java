package com.labtrace.lims.api.service.error;

/**
 * A lab workflow step was requested on a record in the wrong status.
 */
public class WorkflowStateException extends LimsServiceException {

    private static final long serialVersionUID = 1L;

    public WorkflowStateException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
