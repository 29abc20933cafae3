package com.starsalign.imageAlignment.exception;

import lombok.Getter;

/**
 * Too few correspondences survived the ratio test to fit a homography.
 */
@Getter
public class InsufficientCorrespondencesException extends AlignmentException {
    private final int found;
    private final int required;

    public InsufficientCorrespondencesException(int found, int required) {
        super("Not enough correspondences to estimate a homography: found " + found + ", need at least " + required);
        this.found = found;
        this.required = required;
    }
}
