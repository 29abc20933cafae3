package com.starsalign.imageAlignment.matchAndTransform;

import com.starsalign.featureDetection.ImageFeatures;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pairs science keypoints with reference keypoints using the two nearest reference descriptors
 * and Lowe's ratio test.
 */
public class CorrespondenceMatcher {
    private static final Logger logger = LoggerFactory.getLogger(CorrespondenceMatcher.class);

    public static final int NEIGHBOURS = 2;
    public static final double RATIO_THRESHOLD = 0.7;

    private final FeatureMatcher matcher;

    public CorrespondenceMatcher(FeatureMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return correspondences in the order of the science keypoints that produced them
     */
    public List<Correspondence> match(ImageFeatures science, ImageFeatures reference) {
        if (science.isEmpty() || reference.isEmpty()) {
            logger.debug("No descriptors to match (science: {}, reference: {})", science.size(), reference.size());
            return Collections.emptyList();
        }

        List<List<Neighbour>> knnMatches = matcher.knnMatch(science.getDescriptors(), reference.getDescriptors(), NEIGHBOURS);
        List<Correspondence> good = filter(knnMatches, science, reference);

        logger.debug("Ratio test kept {} of {} candidate matches", good.size(), knnMatches.size());
        return good;
    }

    static List<Correspondence> filter(List<List<Neighbour>> knnMatches, ImageFeatures science, ImageFeatures reference) {
        List<Correspondence> good = new ArrayList<>();
        for (List<Neighbour> neighbours : knnMatches) {
            if (neighbours.size() < 2) continue;

            Neighbour m = neighbours.get(0);
            Neighbour n = neighbours.get(1);

            if (passesRatioTest(m, n)) {
                Point2f p1 = science.point(m.getQueryIndex());
                Point2f p2 = reference.point(m.getTrainIndex());
                good.add(new Correspondence(m.getQueryIndex(), m.getTrainIndex(),
                        p1.x(), p1.y(), p2.x(), p2.y(), m.getDistance()));
            }
        }
        return good;
    }

    static boolean passesRatioTest(Neighbour nearest, Neighbour second) {
        return nearest.getDistance() < RATIO_THRESHOLD * second.getDistance();
    }
}
