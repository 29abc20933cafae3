package com.starsalign.imageAlignment;

import com.starsalign.featureDetection.FeatureEngine;
import com.starsalign.featureDetection.ImageFeatures;
import com.starsalign.featureDetection.SiftFeatureEngine;
import com.starsalign.homography.Homography;
import com.starsalign.imageAlignment.exception.DegenerateInputException;
import com.starsalign.imageAlignment.exception.InsufficientCorrespondencesException;
import com.starsalign.imageAlignment.matchAndTransform.Correspondence;
import com.starsalign.imageAlignment.matchAndTransform.CorrespondenceMatcher;
import com.starsalign.imageAlignment.matchAndTransform.FeatureMatcher;
import com.starsalign.imageAlignment.matchAndTransform.FlannFeatureMatcher;
import com.starsalign.imageAlignment.matchAndTransform.HomographyEstimate;
import com.starsalign.imageAlignment.matchAndTransform.HomographyEstimator;
import com.starsalign.imageAlignment.matchAndTransform.RansacHomographyEstimator;
import com.starsalign.imageAlignment.warper.PerspectiveResampler;
import com.starsalign.imageOperator.ChannelAdapter;
import com.starsalign.imageOperator.CodecRoundTripChannelAdapter;
import com.starsalign.imageOperator.DifferenceEngine;
import com.starsalign.imageOperator.DirectChannelAdapter;
import com.starsalign.imageOperator.IntensityNormalizer;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Aligns a science image onto a reference image of the same scene and subtracts them.
 * <p>
 * Both images are normalized to 8 bit, described with SIFT, matched with a 2-NN ratio test and
 * related by a RANSAC homography. The homography is then applied to the original, full-precision
 * science image. Instances hold no per-call state and can be shared between threads.
 *
 * <pre>
 * ImageAligner aligner = ImageAligner.fast();
 * Mat aligned = aligner.align(reference, science);
 * Mat difference = aligner.diff(reference, science);
 * </pre>
 */
@Getter
public class ImageAligner {
    private static final Logger logger = LoggerFactory.getLogger(ImageAligner.class);

    public static final double RATIO_THRESHOLD = CorrespondenceMatcher.RATIO_THRESHOLD;
    public static final double REPROJECTION_THRESHOLD = 5.0;
    public static final int NEIGHBOURS = CorrespondenceMatcher.NEIGHBOURS;
    public static final int MIN_CORRESPONDENCES = RansacHomographyEstimator.MIN_CORRESPONDENCES;

    private final ChannelAdapter channelAdapter;
    private final FeatureEngine featureEngine;
    private final FeatureMatcher featureMatcher;
    private final HomographyEstimator estimator;
    private final DisplacementListener displacementListener;

    public ImageAligner(ChannelAdapter channelAdapter, FeatureEngine featureEngine, FeatureMatcher featureMatcher,
                        HomographyEstimator estimator, DisplacementListener displacementListener) {
        this.channelAdapter = channelAdapter;
        this.featureEngine = featureEngine;
        this.featureMatcher = featureMatcher;
        this.estimator = estimator;
        this.displacementListener = displacementListener;
    }

    public static ImageAligner fast() {
        return forStrategy(AlignmentStrategy.FAST, null);
    }

    public static ImageAligner precise() {
        return forStrategy(AlignmentStrategy.PRECISE, null);
    }

    /**
     * @param scratchDirectory where the precise strategy keeps its temporary files; null for the JVM temp directory
     */
    public static ImageAligner forStrategy(AlignmentStrategy strategy, Path scratchDirectory) {
        ChannelAdapter adapter;
        switch (strategy) {
            case FAST:
                adapter = new DirectChannelAdapter();
                break;
            case PRECISE:
                Path dir = scratchDirectory != null ? scratchDirectory : Paths.get(System.getProperty("java.io.tmpdir"));
                adapter = new CodecRoundTripChannelAdapter(dir);
                break;
            default:
                throw new IllegalArgumentException("Unsupported strategy " + strategy);
        }
        return new ImageAligner(adapter, new SiftFeatureEngine(), new FlannFeatureMatcher(),
                new RansacHomographyEstimator(), new LoggingDisplacementListener());
    }

    public ImageAligner withFeatureMatcher(FeatureMatcher matcher) {
        return new ImageAligner(channelAdapter, featureEngine, matcher, estimator, displacementListener);
    }

    public ImageAligner withDisplacementListener(DisplacementListener listener) {
        return new ImageAligner(channelAdapter, featureEngine, featureMatcher, estimator, listener);
    }

    /**
     * Estimates the science-to-reference homography and warps the science image with it.
     *
     * @throws DegenerateInputException              empty, multi-channel, differently sized or constant images
     * @throws InsufficientCorrespondencesException fewer than four matches survive the ratio test
     * @throws com.starsalign.imageAlignment.exception.EstimationFailureException no valid homography
     * @throws com.starsalign.imageAlignment.exception.ScratchResourceException   precise strategy scratch file trouble
     */
    public Registration register(Mat reference, Mat science) {
        validate(reference, science);

        List<Correspondence> good;
        ImageFeatures scienceFeatures = describe(science);
        try {
            ImageFeatures referenceFeatures = describe(reference);
            try {
                logger.debug("Keypoints: science {}, reference {}", scienceFeatures.size(), referenceFeatures.size());
                good = new CorrespondenceMatcher(featureMatcher).match(scienceFeatures, referenceFeatures);
            } finally {
                referenceFeatures.release();
            }
        } finally {
            scienceFeatures.release();
        }
        if (good.size() < MIN_CORRESPONDENCES) {
            throw new InsufficientCorrespondencesException(good.size(), MIN_CORRESPONDENCES);
        }

        HomographyEstimate estimate = estimator.estimate(good, REPROJECTION_THRESHOLD);
        Homography H = estimate.getHomography();
        displacementListener.displacementEstimated(H.getDx(), H.getDy());

        Mat aligned = PerspectiveResampler.warp(science, H, reference.rows(), reference.cols());
        logger.debug("Aligned with {} inliers of {} correspondences: {}", estimate.getInlierCount(), good.size(), H);

        return new Registration(H, good.size(), estimate.getInlierCount(), aligned);
    }

    /**
     * @return the science image resampled into the reference frame, same size as the reference
     */
    public Mat align(Mat reference, Mat science) {
        return register(reference, science).getAligned();
    }

    /**
     * @return reference minus the aligned science image
     */
    public Mat diff(Mat reference, Mat science) {
        Mat aligned = align(reference, science);
        Mat difference = DifferenceEngine.difference(reference, aligned);
        aligned.release();
        return difference;
    }

    private ImageFeatures describe(Mat image) {
        Mat normalized = IntensityNormalizer.normalize(image);
        Mat prepared = channelAdapter.prepare(normalized);
        try {
            return featureEngine.detectAndDescribe(prepared);
        } finally {
            if (prepared != normalized) prepared.release();
            normalized.release();
        }
    }

    static void validate(Mat reference, Mat science) {
        checkImage(reference, "reference");
        checkImage(science, "science");

        if (reference.rows() != science.rows() || reference.cols() != science.cols()) {
            throw new DegenerateInputException(String.format(
                    "Reference is %dx%d but science is %dx%d",
                    reference.cols(), reference.rows(), science.cols(), science.rows()));
        }
        if (!IntensityNormalizer.hasDynamicRange(reference)) {
            throw new DegenerateInputException("Reference image has zero dynamic range");
        }
        if (!IntensityNormalizer.hasDynamicRange(science)) {
            throw new DegenerateInputException("Science image has zero dynamic range");
        }
    }

    private static void checkImage(Mat image, String role) {
        if (image == null || image.empty()) {
            throw new DegenerateInputException("The " + role + " image is empty");
        }
        if (image.channels() != 1) {
            throw new DegenerateInputException("The " + role + " image has " + image.channels() + " channels, expected 1");
        }
    }
}
