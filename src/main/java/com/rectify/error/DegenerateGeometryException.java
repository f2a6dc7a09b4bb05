package com.rectify.error;

/**
 * The corner quadrilateral cannot define a usable projective transform
 * (collinear corners, zero area, zero-length edges, singular system).
 */
public class DegenerateGeometryException extends RectificationException {

    public DegenerateGeometryException(String message) {
        super(message);
    }
}
