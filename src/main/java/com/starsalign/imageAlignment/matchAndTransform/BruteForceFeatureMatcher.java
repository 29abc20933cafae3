package com.starsalign.imageAlignment.matchAndTransform;

import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * Exhaustive L2 search. Slower than FLANN but gives the same answer on every run.
 */
public class BruteForceFeatureMatcher extends OpenCvFeatureMatcher {

    @Override
    protected DescriptorMatcher createMatcher() {
        return new BFMatcher(NORM_L2, false);
    }
}
