package com.detox.datashift.exception;

public class QualityScoringException extends DataShiftException {
    public QualityScoringException(String message) {
        super("SCORING_FAILURE", message);
    }

    public QualityScoringException(String message, Throwable cause) {
        super("SCORING_FAILURE", message, cause);
    }
}
