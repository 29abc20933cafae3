package com.starsalign.imageAlignment.matchAndTransform;

import java.util.List;

/**
 * Robust fit of a science-to-reference homography.
 */
public interface HomographyEstimator {

    /**
     * @param correspondences       at least four science/reference point pairs
     * @param reprojectionThreshold maximum reprojection error, in pixels, of an inlier
     * @throws com.starsalign.imageAlignment.exception.InsufficientCorrespondencesException with fewer than four pairs
     * @throws com.starsalign.imageAlignment.exception.EstimationFailureException when no valid homography is found
     */
    HomographyEstimate estimate(List<Correspondence> correspondences, double reprojectionThreshold);
}
