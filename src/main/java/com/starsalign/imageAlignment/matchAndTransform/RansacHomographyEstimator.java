package com.starsalign.imageAlignment.matchAndTransform;

import com.starsalign.homography.Homography;
import com.starsalign.imageAlignment.exception.EstimationFailureException;
import com.starsalign.imageAlignment.exception.InsufficientCorrespondencesException;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_calib3d.*;
import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * OpenCV findHomography with RANSAC.
 */
public class RansacHomographyEstimator implements HomographyEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RansacHomographyEstimator.class);

    public static final int MIN_CORRESPONDENCES = 4;

    private static final int MAX_ITERATIONS = 2000;
    private static final double CONFIDENCE = 0.995;
    private static final double MIN_DETERMINANT = 1e-10;

    @Override
    public HomographyEstimate estimate(List<Correspondence> correspondences, double reprojectionThreshold) {
        int count = correspondences.size();
        if (count < MIN_CORRESPONDENCES) {
            throw new InsufficientCorrespondencesException(count, MIN_CORRESPONDENCES);
        }

        Mat srcPoints = toPointMat(correspondences, true);
        Mat dstPoints = toPointMat(correspondences, false);
        Mat mask = new Mat();

        Mat H;
        try {
            H = findHomography(srcPoints, dstPoints, RANSAC, reprojectionThreshold, mask, MAX_ITERATIONS, CONFIDENCE);
        } catch (RuntimeException e) {
            throw new EstimationFailureException("findHomography failed on " + count + " correspondences", e);
        } finally {
            srcPoints.release();
            dstPoints.release();
        }

        if (H == null || H.empty()) {
            mask.release();
            throw new EstimationFailureException("No homography found for " + count + " correspondences");
        }

        Homography homography = Homography.fromMat(H);
        H.release();
        if (!homography.isFinite() || Math.abs(homography.determinant()) < MIN_DETERMINANT) {
            mask.release();
            throw new EstimationFailureException("Degenerate homography " + homography);
        }

        boolean[] inliers = readMask(mask, count);
        mask.release();

        HomographyEstimate estimate = new HomographyEstimate(homography, inliers);
        logger.debug("RANSAC kept {} inliers of {} correspondences", estimate.getInlierCount(), count);
        return estimate;
    }

    // Nx1 CV_32FC2, the layout findHomography expects
    private static Mat toPointMat(List<Correspondence> correspondences, boolean science) {
        int count = correspondences.size();
        Mat mat = new Mat(count, 1, CV_32FC2);
        float[] buf = new float[count * 2];
        for (int i = 0; i < count; i++) {
            Correspondence c = correspondences.get(i);
            buf[2 * i] = science ? c.getScienceX() : c.getReferenceX();
            buf[2 * i + 1] = science ? c.getScienceY() : c.getReferenceY();
        }
        new FloatPointer(mat.data()).put(buf);
        return mat;
    }

    private static boolean[] readMask(Mat mask, int count) {
        boolean[] inliers = new boolean[count];
        if (mask.empty() || mask.total() < count) {
            return inliers;
        }
        BytePointer maskPtr = mask.data();
        for (int i = 0; i < count; i++) {
            inliers[i] = maskPtr.get(i) != 0;
        }
        return inliers;
    }
}
