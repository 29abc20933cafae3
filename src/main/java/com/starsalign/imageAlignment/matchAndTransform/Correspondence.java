package com.starsalign.imageAlignment.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A science keypoint paired with a reference keypoint after the ratio test.
 */
@Getter
@AllArgsConstructor
public class Correspondence {
    private final int scienceIndex;
    private final int referenceIndex;
    private final float scienceX;
    private final float scienceY;
    private final float referenceX;
    private final float referenceY;
    private final float distance;

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f) -> (%.2f, %.2f) d=%.3f", scienceX, scienceY, referenceX, referenceY, distance);
    }
}
