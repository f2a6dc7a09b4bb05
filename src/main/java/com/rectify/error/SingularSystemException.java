package com.rectify.error;

import lombok.Getter;

/**
 * Raised by the DLT solver when no pivot of usable magnitude is left for a column.
 */
@Getter
public class SingularSystemException extends DegenerateGeometryException {

    private final int column;
    private final double pivotMagnitude;

    public SingularSystemException(int column, double pivotMagnitude) {
        super("Homography system is singular: pivot for column " + column
                + " has magnitude " + pivotMagnitude);
        this.column = column;
        this.pivotMagnitude = pivotMagnitude;
    }
}
