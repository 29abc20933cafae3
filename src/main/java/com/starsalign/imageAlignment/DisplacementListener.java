package com.starsalign.imageAlignment;

/**
 * Receives the translation terms of each estimated homography. Informational only.
 */
@FunctionalInterface
public interface DisplacementListener {

    void displacementEstimated(double dx, double dy);
}
