package com.labtrace.lims.api.service.error;

public class RecordNotFoundException extends LimsServiceException {

    private static final long serialVersionUID = 1L;

    public RecordNotFoundException(String recordType, Object id) {
        super(recordType + " not found: " + id);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
