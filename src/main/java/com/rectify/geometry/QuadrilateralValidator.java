package com.rectify.geometry;

import com.rectify.error.DegenerateGeometryException;

import java.util.List;

/**
 * Rejects quadrilaterals that cannot produce a well-conditioned homography:
 * any three corners (nearly) collinear, or no enclosed area.
 */
public class QuadrilateralValidator {

    private static final String[] NAMES = {"top-left", "top-right", "bottom-right", "bottom-left"};

    private final double minTriangleArea;

    public QuadrilateralValidator(double minTriangleArea) {
        this.minTriangleArea = minTriangleArea;
    }

    public void validate(Quadrilateral quad) {
        List<Point2D> c = quad.corners();
        for (Point2D p : c) {
            if (!Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) {
                throw new DegenerateGeometryException("Corner " + p + " is not a finite coordinate");
            }
        }

        // every triple leaves out exactly one corner
        for (int skip = 0; skip < 4; skip++) {
            Point2D a = c.get((skip + 1) % 4);
            Point2D b = c.get((skip + 2) % 4);
            Point2D d = c.get((skip + 3) % 4);
            double area = Math.abs(triangleArea(a, b, d));
            if (area < minTriangleArea) {
                throw new DegenerateGeometryException("Corners " + NAMES[(skip + 1) % 4] + ", "
                        + NAMES[(skip + 2) % 4] + " and " + NAMES[(skip + 3) % 4]
                        + " are collinear (triangle area " + area + ")");
            }
        }

        double area = Math.abs(quad.signedArea());
        if (area < minTriangleArea) {
            throw new DegenerateGeometryException("Quadrilateral encloses no area (" + area + ")");
        }
    }

    static double triangleArea(Point2D a, Point2D b, Point2D c) {
        return ((b.getX() - a.getX()) * (c.getY() - a.getY())
                - (c.getX() - a.getX()) * (b.getY() - a.getY())) / 2.0;
    }
}
