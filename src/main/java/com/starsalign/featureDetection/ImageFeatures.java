package com.starsalign.featureDetection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;

/**
 * Keypoints of one image and their descriptors, row i of {@code descriptors} describing keypoint i.
 */
@Getter
@AllArgsConstructor
public class ImageFeatures {
    private final KeyPointVector keypoints;
    private final Mat descriptors;

    public int size() {
        return (int) keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.size() == 0 || descriptors == null || descriptors.empty();
    }

    public Point2f point(int index) {
        KeyPoint kp = keypoints.get(index);
        return new Point2f(kp.pt().x(), kp.pt().y());
    }

    /**
     * Frees the native keypoint vector and descriptor matrix. The features are unusable afterwards.
     */
    public void release() {
        if (descriptors != null) descriptors.release();
        if (keypoints != null) keypoints.close();
    }
}
