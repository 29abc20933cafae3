package com.starsalign.imageAlignment.exception;

/**
 * The scratch file used by the precise channel adapter could not be created, used or removed.
 */
public class ScratchResourceException extends AlignmentException {

    public ScratchResourceException(String message) {
        super(message);
    }

    public ScratchResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
