package com.starsalign.imageAlignment.matchAndTransform;

import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;
import org.bytedeco.opencv.opencv_features2d.FlannBasedMatcher;
import org.bytedeco.opencv.opencv_flann.KDTreeIndexParams;
import org.bytedeco.opencv.opencv_flann.SearchParams;

/**
 * Approximate search over a randomized KD-tree index (5 trees, 50 checks). Default matcher for alignment.
 */
public class FlannFeatureMatcher extends OpenCvFeatureMatcher {
    public static final int TREES = 5;
    public static final int CHECKS = 50;

    @Override
    protected DescriptorMatcher createMatcher() {
        KDTreeIndexParams indexParams = new KDTreeIndexParams(TREES);
        SearchParams searchParams = new SearchParams(CHECKS, 0, true);
        FlannBasedMatcher matcher = new FlannBasedMatcher(indexParams, searchParams);
        // the matcher's cv::Ptr now owns both parameter objects
        indexParams.deallocate(false);
        searchParams.deallocate(false);
        return matcher;
    }
}
