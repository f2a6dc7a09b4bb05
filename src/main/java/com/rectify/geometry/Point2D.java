package com.rectify.geometry;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Point2D {
    private final double x;
    private final double y;

    public double distanceTo(Point2D other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public Point2D scale(double sx, double sy) {
        return new Point2D(x * sx, y * sy);
    }
}
