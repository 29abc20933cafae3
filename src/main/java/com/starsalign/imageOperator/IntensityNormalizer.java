package com.starsalign.imageOperator;

import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Linear per-image rescale of an arbitrary-range image into 8 bit, so that the feature engine
 * sees the full dynamic range of each image.
 */
public class IntensityNormalizer {

    private IntensityNormalizer() {
    }

    /**
     * Maps the image's own [min, max] to [0, 255], rounding to the nearest integer.
     * A constant image has no range to stretch and comes back all zeros.
     *
     * @param image single-channel image of any depth
     * @return CV_8U image of the same size
     */
    public static Mat normalize(Mat image) {
        double[] range = range(image);
        double min = range[0];
        double max = range[1];

        if (!(max > min)) {
            return new Mat(image.rows(), image.cols(), CV_8U, new Scalar(0.0));
        }

        double alpha = 255.0 / (max - min);
        double beta = -min * alpha;
        Mat normalized = new Mat();
        image.convertTo(normalized, CV_8U, alpha, beta);
        return normalized;
    }

    /**
     * @return {min, max} of a single-channel image
     */
    public static double[] range(Mat image) {
        DoublePointer minVal = new DoublePointer(1);
        DoublePointer maxVal = new DoublePointer(1);
        try {
            minMaxLoc(image, minVal, maxVal, null, null, new Mat());
            return new double[]{minVal.get(), maxVal.get()};
        } finally {
            minVal.close();
            maxVal.close();
        }
    }

    public static boolean hasDynamicRange(Mat image) {
        double[] range = range(image);
        return range[1] > range[0];
    }
}
