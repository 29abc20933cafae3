package com.starsalign.imageAlignment.matchAndTransform;

import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * k-nearest-neighbour search of descriptors.
 */
public interface FeatureMatcher {

    /**
     * For every row of {@code query}, its (up to) k nearest rows of {@code train}, closest first.
     * The outer list follows the row order of {@code query}.
     */
    List<List<Neighbour>> knnMatch(Mat query, Mat train, int k);
}
