package com.detox.datashift.exception;

public class InvalidBaselineException extends DataShiftException {
    public InvalidBaselineException(String message) {
        super("BASELINE_VALIDATION_FAILURE", message);
    }
}
