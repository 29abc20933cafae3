package com.starsalign.imageAlignment.exception;

/**
 * Input images cannot be aligned: empty, multi-channel, mismatched shapes or zero dynamic range.
 */
public class DegenerateInputException extends AlignmentException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
