package com.starsalign.featureDetection;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Keypoint detector and descriptor extractor.
 */
public interface FeatureEngine {

    ImageFeatures detectAndDescribe(Mat image);
}
