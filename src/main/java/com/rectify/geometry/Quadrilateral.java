package com.rectify.geometry;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Four corners of the document region, in the fixed order
 * top-left, top-right, bottom-right, bottom-left.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Quadrilateral {
    private final Point2D topLeft;
    private final Point2D topRight;
    private final Point2D bottomRight;
    private final Point2D bottomLeft;

    /**
     * Target rectangle of the rectified output: (0,0) (w,0) (w,h) (0,h).
     */
    public static Quadrilateral rectangle(OutputDimensions dims) {
        double w = dims.getWidth();
        double h = dims.getHeight();
        return new Quadrilateral(
                new Point2D(0, 0),
                new Point2D(w, 0),
                new Point2D(w, h),
                new Point2D(0, h));
    }

    public List<Point2D> corners() {
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }

    public Quadrilateral scale(double sx, double sy) {
        return new Quadrilateral(
                topLeft.scale(sx, sy),
                topRight.scale(sx, sy),
                bottomRight.scale(sx, sy),
                bottomLeft.scale(sx, sy));
    }

    // shoelace; positive for TL, TR, BR, BL in y-down image coordinates
    public double signedArea() {
        List<Point2D> c = corners();
        double sum = 0;
        for (int i = 0; i < 4; i++) {
            Point2D a = c.get(i);
            Point2D b = c.get((i + 1) % 4);
            sum += a.getX() * b.getY() - b.getX() * a.getY();
        }
        return sum / 2.0;
    }
}
