package com.starsalign.imageAlignment.matchAndTransform;

import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs an OpenCV descriptor matcher and copies its results out of native memory.
 * A fresh matcher is built per call.
 */
public abstract class OpenCvFeatureMatcher implements FeatureMatcher {

    protected abstract DescriptorMatcher createMatcher();

    @Override
    public List<List<Neighbour>> knnMatch(Mat query, Mat train, int k) {
        if (query == null || query.empty() || train == null || train.empty()) {
            return Collections.emptyList();
        }

        DescriptorMatcher matcher = createMatcher();
        DMatchVectorVector knnMatches = new DMatchVectorVector();
        try {
            matcher.knnMatch(query, train, knnMatches, k);

            long size = knnMatches.size();
            List<List<Neighbour>> result = new ArrayList<>((int) size);
            for (long i = 0; i < size; i++) {
                DMatchVector matches = knnMatches.get(i);
                List<Neighbour> neighbours = new ArrayList<>((int) matches.size());
                for (long j = 0; j < matches.size(); j++) {
                    DMatch m = matches.get(j);
                    neighbours.add(new Neighbour(m.queryIdx(), m.trainIdx(), m.distance()));
                }
                result.add(neighbours);
            }
            return result;
        } finally {
            knnMatches.close();
            matcher.close();
        }
    }
}
