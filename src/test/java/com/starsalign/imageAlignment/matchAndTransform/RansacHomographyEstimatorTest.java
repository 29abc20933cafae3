package com.starsalign.imageAlignment.matchAndTransform;

import com.starsalign.homography.Homography;
import com.starsalign.imageAlignment.exception.EstimationFailureException;
import com.starsalign.imageAlignment.exception.InsufficientCorrespondencesException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class RansacHomographyEstimatorTest {

    private final RansacHomographyEstimator estimator = new RansacHomographyEstimator();

    private static List<Correspondence> correspondences(Homography truth, int inliers, int outliers, long seed) {
        Random rnd = new Random(seed);
        List<Correspondence> list = new ArrayList<>();
        for (int i = 0; i < inliers + outliers; i++) {
            double x = rnd.nextDouble() * 300;
            double y = rnd.nextDouble() * 200;
            double[] p = truth.project(x, y);
            if (i >= inliers) {
                // far from the true mapping
                p = new double[]{p[0] + 40 + rnd.nextDouble() * 60, p[1] - 40 - rnd.nextDouble() * 60};
            }
            list.add(new Correspondence(i, i, (float) x, (float) y, (float) p[0], (float) p[1], 1f));
        }
        return list;
    }

    @Test
    void recoversTranslation() {
        Homography truth = Homography.translation(12.0, -7.0);

        HomographyEstimate estimate = estimator.estimate(correspondences(truth, 40, 0, 1), 5.0);

        assertThat(estimate.getHomography().getDx()).isCloseTo(12.0, within(1e-3));
        assertThat(estimate.getHomography().getDy()).isCloseTo(-7.0, within(1e-3));
        assertThat(estimate.getInlierCount()).isEqualTo(40);
    }

    @Test
    void rejectsOutliers() {
        Homography truth = new Homography(new double[][]{
                {0.995, -0.0998, 8.0},
                {0.0998, 0.995, 3.5},
                {0, 0, 1}});
        List<Correspondence> all = correspondences(truth, 50, 15, 2);

        HomographyEstimate estimate = estimator.estimate(all, 5.0);

        assertThat(estimate.getHomography().maxDeviation(truth)).isLessThan(1e-2);
        boolean[] mask = estimate.getInlierMask();
        assertThat(mask).hasSize(65);
        for (int i = 0; i < 50; i++) assertThat(mask[i]).as("inlier %d", i).isTrue();
        for (int i = 50; i < 65; i++) assertThat(mask[i]).as("outlier %d", i).isFalse();
    }

    @Test
    void needsFourCorrespondences() {
        List<Correspondence> three = correspondences(Homography.identity(), 3, 0, 3);

        assertThatThrownBy(() -> estimator.estimate(three, 5.0))
                .isInstanceOf(InsufficientCorrespondencesException.class)
                .satisfies(e -> {
                    InsufficientCorrespondencesException ice = (InsufficientCorrespondencesException) e;
                    assertThat(ice.getFound()).isEqualTo(3);
                    assertThat(ice.getRequired()).isEqualTo(4);
                });
    }

    @Test
    void coincidentPointsHaveNoHomography() {
        List<Correspondence> same = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            same.add(new Correspondence(i, i, 50f, 60f, 62f, 53f, 1f));
        }

        assertThatThrownBy(() -> estimator.estimate(same, 5.0))
                .isInstanceOf(EstimationFailureException.class);
    }

    @Test
    void collinearPointsHaveNoHomography() {
        List<Correspondence> line = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            float x = 10f * i;
            float y = 20f * i + 5f;
            line.add(new Correspondence(i, i, x, y, x + 3f, y - 2f, 1f));
        }

        assertThatThrownBy(() -> estimator.estimate(line, 5.0))
                .isInstanceOf(EstimationFailureException.class);
    }
}
