package com.labtrace.lims.api.web.rest.api;

public enum ResultStatus {
    SUCCESS(200),
    ERROR(-1);

    private final int code;

    ResultStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
