package com.detox.datashift.exception;

public class BaselinePersistenceException extends DataShiftException {
    public BaselinePersistenceException(String message, Throwable cause) {
        super("BASELINE_PERSISTENCE_FAILURE", message, cause);
    }
}
