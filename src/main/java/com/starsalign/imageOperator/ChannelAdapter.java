package com.starsalign.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Prepares a normalized 8-bit image for the feature engine.
 */
public interface ChannelAdapter {

    /**
     * @param normalized single-channel CV_8U image
     * @return single-channel CV_8U image handed to the feature engine
     */
    Mat prepare(Mat normalized);
}
