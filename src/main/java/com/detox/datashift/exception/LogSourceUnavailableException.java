package com.detox.datashift.exception;

public class LogSourceUnavailableException extends DataShiftException {
    public LogSourceUnavailableException(String message) {
        super("SOURCE_UNAVAILABLE", message);
    }

    public LogSourceUnavailableException(String message, Throwable cause) {
        super("SOURCE_UNAVAILABLE", message, cause);
    }
}
