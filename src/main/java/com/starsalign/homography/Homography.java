package com.starsalign.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * 3x3 planar homography mapping science-image coordinates to reference-image coordinates.
 */
public class Homography {
    private final double[][] data;

    public Homography(double[][] data) {
        if (data.length != 3 || data[0].length != 3 || data[1].length != 3 || data[2].length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][];
        for (int r = 0; r < 3; r++) this.data[r] = data[r].clone();
    }

    public static Homography identity() {
        return new Homography(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
    }

    public static Homography translation(double dx, double dy) {
        return new Homography(new double[][]{{1, 0, dx}, {0, 1, dy}, {0, 0, 1}});
    }

    /**
     * Reads a 3x3 CV_64F matrix as returned by findHomography.
     */
    public static Homography fromMat(Mat m) {
        if (m == null || m.empty() || m.rows() != 3 || m.cols() != 3) {
            throw new IllegalArgumentException("Expected a 3x3 matrix");
        }
        Mat m64 = m;
        if (m.type() != CV_64F) {
            m64 = new Mat();
            m.convertTo(m64, CV_64F);
        }
        double[][] data = new double[3][3];
        try (DoubleIndexer idx = m64.createIndexer()) {
            for (int r = 0; r < 3; r++)
                for (int c = 0; c < 3; c++)
                    data[r][c] = idx.get(r, c);
        } finally {
            if (m64 != m) m64.release();
        }
        return new Homography(data);
    }

    public Mat toMat() {
        Mat m = new Mat(3, 3, CV_64F);
        try (DoubleIndexer idx = m.createIndexer()) {
            for (int r = 0; r < 3; r++)
                for (int c = 0; c < 3; c++)
                    idx.put(r, c, data[r][c]);
        }
        return m;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) copy[r] = data[r].clone();
        return copy;
    }

    // Translation terms, reported as the x/y displacement between the two images
    public double getDx() {
        return data[0][2];
    }

    public double getDy() {
        return data[1][2];
    }

    /**
     * Maps (x, y) through the homography. Returns null for points sent to infinity.
     */
    public double[] project(double x, double y) {
        double z_prime = data[2][0] * x + data[2][1] * y + data[2][2];
        if (Math.abs(z_prime) < 1e-10) return null;

        double x_prime = (data[0][0] * x + data[0][1] * y + data[0][2]) / z_prime;
        double y_prime = (data[1][0] * x + data[1][1] * y + data[1][2]) / z_prime;

        return new double[]{x_prime, y_prime};
    }

    public double determinant() {
        double[][] h = data;
        return h[0][0] * (h[1][1] * h[2][2] - h[1][2] * h[2][1])
                - h[0][1] * (h[1][0] * h[2][2] - h[1][2] * h[2][0])
                + h[0][2] * (h[1][0] * h[2][1] - h[1][1] * h[2][0]);
    }

    public boolean isFinite() {
        for (double[] row : data)
            for (double v : row)
                if (!Double.isFinite(v)) return false;
        return true;
    }

    /**
     * Inverse via the adjugate, rescaled so that h[2][2] == 1 when possible.
     */
    public Homography inverse() {
        double det = determinant();
        if (Math.abs(det) < 1e-12) {
            throw new IllegalStateException("Homography is singular");
        }
        double[][] h = data;
        double[][] inv = new double[3][3];
        inv[0][0] = (h[1][1] * h[2][2] - h[1][2] * h[2][1]) / det;
        inv[0][1] = (h[0][2] * h[2][1] - h[0][1] * h[2][2]) / det;
        inv[0][2] = (h[0][1] * h[1][2] - h[0][2] * h[1][1]) / det;
        inv[1][0] = (h[1][2] * h[2][0] - h[1][0] * h[2][2]) / det;
        inv[1][1] = (h[0][0] * h[2][2] - h[0][2] * h[2][0]) / det;
        inv[1][2] = (h[0][2] * h[1][0] - h[0][0] * h[1][2]) / det;
        inv[2][0] = (h[1][0] * h[2][1] - h[1][1] * h[2][0]) / det;
        inv[2][1] = (h[0][1] * h[2][0] - h[0][0] * h[2][1]) / det;
        inv[2][2] = (h[0][0] * h[1][1] - h[0][1] * h[1][0]) / det;

        if (Math.abs(inv[2][2]) > 1e-12) {
            double s = inv[2][2];
            for (int r = 0; r < 3; r++)
                for (int c = 0; c < 3; c++)
                    inv[r][c] /= s;
        }
        return new Homography(inv);
    }

    /**
     * Largest absolute element-wise deviation from another homography.
     */
    public double maxDeviation(Homography other) {
        double max = 0;
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                max = Math.max(max, Math.abs(data[r][c] - other.data[r][c]));
        return max;
    }

    @Override
    public String toString() {
        return String.format("Homography[[%.6f, %.6f, %.4f], [%.6f, %.6f, %.4f], [%.8f, %.8f, %.6f]]",
                data[0][0], data[0][1], data[0][2],
                data[1][0], data[1][1], data[1][2],
                data[2][0], data[2][1], data[2][2]);
    }
}
