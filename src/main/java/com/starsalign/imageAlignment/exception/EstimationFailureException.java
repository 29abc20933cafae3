package com.starsalign.imageAlignment.exception;

public class EstimationFailureException extends AlignmentException {

    public EstimationFailureException(String message) {
        super(message);
    }

    public EstimationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
