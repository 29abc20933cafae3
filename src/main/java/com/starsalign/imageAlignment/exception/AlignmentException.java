package com.starsalign.imageAlignment.exception;

/**
 * Base of every error that aborts an alignment call. None of them is recoverable within the call.
 */
public abstract class AlignmentException extends RuntimeException {

    protected AlignmentException(String message) {
        super(message);
    }

    protected AlignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
