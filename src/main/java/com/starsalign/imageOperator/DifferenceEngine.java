package com.starsalign.imageOperator;

import com.starsalign.imageAlignment.exception.DegenerateInputException;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Pixel-wise reference minus aligned science image. No clamping and no renormalization.
 */
public class DifferenceEngine {

    private DifferenceEngine() {
    }

    public static Mat difference(Mat reference, Mat aligned) {
        if (reference.rows() != aligned.rows() || reference.cols() != aligned.cols()
                || reference.channels() != aligned.channels()) {
            throw new DegenerateInputException(String.format(
                    "Cannot subtract %dx%d (%d ch) from %dx%d (%d ch)",
                    aligned.cols(), aligned.rows(), aligned.channels(),
                    reference.cols(), reference.rows(), reference.channels()));
        }

        Mat diff = new Mat();
        subtract(reference, aligned, diff, new Mat(), resultDepth(reference.depth()));
        return diff;
    }

    // Unsigned inputs would saturate at zero, so they are promoted to float
    static int resultDepth(int depth) {
        if (depth == CV_8U || depth == CV_16U) return CV_32F;
        return depth;
    }
}
