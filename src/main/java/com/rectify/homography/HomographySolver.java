package com.rectify.homography;

import com.rectify.error.SingularSystemException;
import com.rectify.geometry.Point2D;
import com.rectify.geometry.Quadrilateral;

import java.util.List;

/**
 * Four-point homography by Direct Linear Transform.
 * <p>
 * Each correspondence (x, y) -> (u, v) gives two rows in the unknowns h1..h8 (h9 = 1):
 * <pre>
 *   x y 1 0 0 0 -xu -yu | u
 *   0 0 0 x y 1 -xv -yv | v
 * </pre>
 * The 8x9 system is reduced by Gauss-Jordan elimination with partial pivoting.
 */
public class HomographySolver {

    public static final double PIVOT_TOLERANCE = 1e-12;

    private static final int UNKNOWNS = 8;

    /**
     * Homography taking each corner of {@code from} onto the matching corner of {@code to}.
     *
     * @throws SingularSystemException if a column has no pivot above {@link #PIVOT_TOLERANCE}
     */
    public HomographyMatrix solve(Quadrilateral from, Quadrilateral to) {
        return HomographyMatrix.fromCoefficients(reduce(buildSystem(from, to)));
    }

    static AugmentedMatrix buildSystem(Quadrilateral from, Quadrilateral to) {
        List<Point2D> src = from.corners();
        List<Point2D> dst = to.corners();
        double[][] a = new double[UNKNOWNS][UNKNOWNS + 1];

        for (int i = 0; i < 4; i++) {
            double x = src.get(i).getX();
            double y = src.get(i).getY();
            double u = dst.get(i).getX();
            double v = dst.get(i).getY();

            a[2*i][0] = x;
            a[2*i][1] = y;
            a[2*i][2] = 1;
            a[2*i][6] = -x * u;
            a[2*i][7] = -y * u;
            a[2*i][8] = u;

            a[2*i+1][3] = x;
            a[2*i+1][4] = y;
            a[2*i+1][5] = 1;
            a[2*i+1][6] = -x * v;
            a[2*i+1][7] = -y * v;
            a[2*i+1][8] = v;
        }
        return AugmentedMatrix.of(a);
    }

    static double[] reduce(AugmentedMatrix system) {
        AugmentedMatrix m = system;
        for (int col = 0; col < m.size(); col++) {
            int pivot = m.pivotRow(col, col);
            double magnitude = Math.abs(m.get(pivot, col));
            if (!(magnitude >= PIVOT_TOLERANCE)) {
                throw new SingularSystemException(col, magnitude);
            }
            m = m.swapRows(col, pivot)
                    .normalizeRow(col, col)
                    .eliminateColumn(col, col);
        }
        return m.solution();
    }
}
