package com.labtrace.lims.api.service.error;

public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    VALIDATION,
    UPSTREAM_FAILURE,
}
