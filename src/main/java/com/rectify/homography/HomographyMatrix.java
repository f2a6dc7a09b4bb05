package com.rectify.homography;

import java.util.Arrays;

public class HomographyMatrix {
    private static final double EPS = 1e-10;

    private final double[][] data;

    public HomographyMatrix(double[][] data) {
        if (data.length != 3 || data[0].length != 3 || data[1].length != 3 || data[2].length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][];
        for (int r = 0; r < 3; r++) {
            this.data[r] = data[r].clone();
        }
    }

    // h1..h8 row-major, h9 = 1
    public static HomographyMatrix fromCoefficients(double[] h) {
        return new HomographyMatrix(new double[][]{
                {h[0], h[1], h[2]},
                {h[3], h[4], h[5]},
                {h[6], h[7], 1.0}
        });
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) {
            copy[r] = data[r].clone();
        }
        return copy;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double[] toArray() {
        return new double[]{
                data[0][0], data[0][1], data[0][2],
                data[1][0], data[1][1], data[1][2],
                data[2][0], data[2][1], data[2][2]
        };
    }

    public double[] project(double x, double y) {
        double z_prime = data[2][0] * x + data[2][1] * y + data[2][2];
        if (Math.abs(z_prime) < EPS) return null;

        double x_prime = (data[0][0] * x + data[0][1] * y + data[0][2]) / z_prime;
        double y_prime = (data[1][0] * x + data[1][1] * y + data[1][2]) / z_prime;

        return new double[]{x_prime, y_prime};
    }

    public double determinant() {
        double[][] m = data;
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    // adjugate / det, then rescaled so [2][2] == 1
    public HomographyMatrix inverse() {
        double det = determinant();
        if (Math.abs(det) < EPS) {
            throw new ArithmeticException("Homography is singular (det=" + det + ")");
        }
        double[][] m = data;
        double[][] inv = new double[3][3];
        inv[0][0] = (m[1][1] * m[2][2] - m[1][2] * m[2][1]) / det;
        inv[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) / det;
        inv[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) / det;
        inv[1][0] = (m[1][2] * m[2][0] - m[1][0] * m[2][2]) / det;
        inv[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) / det;
        inv[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) / det;
        inv[2][0] = (m[1][0] * m[2][1] - m[1][1] * m[2][0]) / det;
        inv[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) / det;
        inv[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) / det;

        double scale = inv[2][2];
        if (Math.abs(scale) < EPS) {
            throw new ArithmeticException("Inverse homography cannot be normalized");
        }
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                inv[r][c] /= scale;
            }
        }
        return new HomographyMatrix(inv);
    }

    @Override
    public String toString() {
        return "HomographyMatrix" + Arrays.deepToString(data);
    }
}
