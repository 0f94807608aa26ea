package com.detox.datashift.exception;

import lombok.Getter;

@Getter
public abstract class DataShiftException extends RuntimeException {
    private final String errorCode;

    protected DataShiftException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DataShiftException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
