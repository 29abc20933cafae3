package com.starsalign.imageAlignment.warper;

import com.starsalign.homography.Homography;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

/**
 * Brings the science image into the reference frame.
 */
public class PerspectiveResampler {

    private PerspectiveResampler() {
    }

    /**
     * Backward warp: every output pixel is sampled bilinearly at H^-1 of its position in
     * {@code science}. Pixels that fall outside the source are 0.
     *
     * @param science full-precision science image, not the normalized one
     * @param H       science to reference homography
     * @param rows    reference height
     * @param cols    reference width
     */
    public static Mat warp(Mat science, Homography H, int rows, int cols) {
        Mat M = H.toMat();
        Mat aligned = new Mat();
        try {
            warpPerspective(science, aligned, M, new Size(cols, rows), INTER_LINEAR, BORDER_CONSTANT, new Scalar(0.0));
        } finally {
            M.release();
        }
        return aligned;
    }
}
