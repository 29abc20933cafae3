package com.starsalign.featureDetection;

import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.SIFT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenCV SIFT with its default parameters (all features, 3 octave layers, contrast 0.04,
 * edge 10, sigma 1.6). A detector is created per call so instances can be shared between threads.
 */
public class SiftFeatureEngine implements FeatureEngine {
    private static final Logger logger = LoggerFactory.getLogger(SiftFeatureEngine.class);

    @Override
    public ImageFeatures detectAndDescribe(Mat image) {
        long start = System.currentTimeMillis();

        SIFT sift = SIFT.create();
        KeyPointVector keyPoints = new KeyPointVector();
        Mat descriptors = new Mat();
        try {
            sift.detectAndCompute(image, new Mat(), keyPoints, descriptors);
        } finally {
            sift.close();
        }

        logger.debug("SIFT: {} keypoints, descriptors [{} x {}] in {} ms",
                keyPoints.size(), descriptors.rows(), descriptors.cols(), System.currentTimeMillis() - start);
        return new ImageFeatures(keyPoints, descriptors);
    }
}
