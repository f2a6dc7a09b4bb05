package com.rectify.geometry;

import com.rectify.error.InvalidCornerCountException;

import java.util.List;

/**
 * Turns the caller's corner list into a {@link Quadrilateral}.
 * <p>
 * The caller orders the points top-left, top-right, bottom-right, bottom-left.
 * That order is trusted: no reordering and no collinearity check happen here.
 */
public class CornerNormalizer {

    public static final int CORNER_COUNT = 4;

    public Quadrilateral normalize(List<Point2D> points) {
        int count = points == null ? 0 : points.size();
        if (count != CORNER_COUNT) {
            throw new InvalidCornerCountException(count);
        }
        return new Quadrilateral(points.get(0), points.get(1), points.get(2), points.get(3));
    }
}
