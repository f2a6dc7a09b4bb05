package com.rectify.geometry;

import com.rectify.error.OutputTooLargeException;

/**
 * Derives the size of the rectified image from the quadrilateral's edges.
 * <p>
 * Each side uses the longer of its two parallel edges, so the edge shortened by
 * perspective foreshortening does not shrink the output.
 */
public class OutputDimensionEstimator {

    public OutputDimensions estimate(Quadrilateral quad) {
        double top = quad.getTopLeft().distanceTo(quad.getTopRight());
        double bottom = quad.getBottomLeft().distanceTo(quad.getBottomRight());
        double left = quad.getTopLeft().distanceTo(quad.getBottomLeft());
        double right = quad.getTopRight().distanceTo(quad.getBottomRight());

        long width = Math.round(Math.max(top, bottom));
        long height = Math.round(Math.max(left, right));
        if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) {
            throw new OutputTooLargeException(width, height, "the largest representable image side");
        }
        return new OutputDimensions((int) width, (int) height);
    }
}
