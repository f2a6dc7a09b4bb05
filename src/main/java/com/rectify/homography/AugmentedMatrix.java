package com.rectify.homography;

/**
 * Immutable n x (n+1) augmented matrix [A | b]. Every elimination step returns a new instance,
 * so a single pivot or elimination can be checked on its own.
 */
public final class AugmentedMatrix {
    private final double[][] rows;

    private AugmentedMatrix(double[][] rows) {
        this.rows = rows;
    }

    /**
     * Copies {@code rows}; each must have n + 1 entries.
     */
    public static AugmentedMatrix of(double[][] rows) {
        int n = rows.length;
        double[][] copy = new double[n][];
        for (int r = 0; r < n; r++) {
            if (rows[r].length != n + 1) {
                throw new IllegalArgumentException("Row " + r + " must have " + (n + 1) + " entries");
            }
            copy[r] = rows[r].clone();
        }
        return new AugmentedMatrix(copy);
    }

    public int size() {
        return rows.length;
    }

    public double get(int row, int col) {
        return rows[row][col];
    }

    // row in [fromRow, n) with the largest |value| in col
    public int pivotRow(int col, int fromRow) {
        int best = fromRow;
        for (int r = fromRow + 1; r < rows.length; r++) {
            if (Math.abs(rows[r][col]) > Math.abs(rows[best][col])) {
                best = r;
            }
        }
        return best;
    }

    public AugmentedMatrix swapRows(int i, int j) {
        if (i == j) return this;
        double[][] next = copyRows();
        double[] tmp = next[i];
        next[i] = next[j];
        next[j] = tmp;
        return new AugmentedMatrix(next);
    }

    public AugmentedMatrix normalizeRow(int row, int col) {
        double[][] next = copyRows();
        double pivot = next[row][col];
        for (int c = 0; c < next[row].length; c++) {
            next[row][c] /= pivot;
        }
        next[row][col] = 1.0;
        return new AugmentedMatrix(next);
    }

    // pivotRow must already be normalized
    public AugmentedMatrix eliminateColumn(int pivotRow, int col) {
        double[][] next = copyRows();
        double[] pivot = next[pivotRow];
        for (int r = 0; r < next.length; r++) {
            if (r == pivotRow) continue;
            double factor = next[r][col];
            if (factor == 0.0) continue;
            for (int c = 0; c < pivot.length; c++) {
                next[r][c] -= factor * pivot[c];
            }
            next[r][col] = 0.0;
        }
        return new AugmentedMatrix(next);
    }

    public double[] solution() {
        double[] x = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            x[r] = rows[r][rows.length];
        }
        return x;
    }

    private double[][] copyRows() {
        double[][] copy = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            copy[r] = rows[r].clone();
        }
        return copy;
    }
}
