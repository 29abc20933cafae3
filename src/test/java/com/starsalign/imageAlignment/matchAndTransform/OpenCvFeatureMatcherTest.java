package com.starsalign.imageAlignment.matchAndTransform;

import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bytedeco.opencv.global.opencv_core.CV_32F;

class OpenCvFeatureMatcherTest {

    // One-hot style descriptors: row i is far from every other row except its noisy copy
    private static Mat descriptors(int rows, int cols, float noise) {
        Mat mat = new Mat(rows, cols, CV_32F);
        float[] buf = new float[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                buf[r * cols + c] = (c % rows == r ? 100f : 0f) + noise * ((r + c) % 3);
            }
        }
        new FloatPointer(mat.data()).put(buf);
        return mat;
    }

    private static void assertSelfMatches(FeatureMatcher matcher) {
        Mat train = descriptors(6, 32, 0f);
        Mat query = descriptors(6, 32, 0.5f);

        List<List<Neighbour>> knn = matcher.knnMatch(query, train, 2);

        assertThat(knn).hasSize(6);
        for (int i = 0; i < 6; i++) {
            List<Neighbour> neighbours = knn.get(i);
            assertThat(neighbours).hasSize(2);
            assertThat(neighbours.get(0).getQueryIndex()).isEqualTo(i);
            assertThat(neighbours.get(0).getTrainIndex()).isEqualTo(i);
            assertThat(neighbours.get(0).getDistance()).isLessThan(neighbours.get(1).getDistance());
        }
    }

    @Test
    void bruteForceFindsNearestDescriptor() {
        assertSelfMatches(new BruteForceFeatureMatcher());
    }

    @Test
    void flannFindsNearestDescriptor() {
        assertSelfMatches(new FlannFeatureMatcher());
    }

    @Test
    void flannUsesFiveTreesAndFiftyChecks() {
        assertThat(FlannFeatureMatcher.TREES).isEqualTo(5);
        assertThat(FlannFeatureMatcher.CHECKS).isEqualTo(50);
    }

    @Test
    void flannIndexParametersAreFreedOnlyOnce() {
        FlannFeatureMatcher matcher = new FlannFeatureMatcher();
        for (int i = 0; i < 20; i++) {
            assertSelfMatches(matcher);
            System.gc();
        }
    }

    @Test
    void emptyDescriptorsGiveNoMatches() {
        assertThat(new BruteForceFeatureMatcher().knnMatch(new Mat(), descriptors(3, 8, 0f), 2)).isEmpty();
        assertThat(new FlannFeatureMatcher().knnMatch(descriptors(3, 8, 0f), new Mat(), 2)).isEmpty();
    }

    @Test
    void singleTrainDescriptorYieldsOneNeighbour() {
        List<List<Neighbour>> knn = new BruteForceFeatureMatcher().knnMatch(descriptors(3, 8, 0f), descriptors(1, 8, 0f), 2);

        assertThat(knn).hasSize(3);
        assertThat(knn).allSatisfy(neighbours -> assertThat(neighbours).hasSize(1));
    }
}
