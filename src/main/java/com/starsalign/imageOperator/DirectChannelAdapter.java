package com.starsalign.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Fast path: the normalized image goes straight to the feature engine.
 */
public class DirectChannelAdapter implements ChannelAdapter {

    @Override
    public Mat prepare(Mat normalized) {
        return normalized;
    }
}
