package com.rectify.error;

public class OutputTooLargeException extends RectificationException {

    public OutputTooLargeException(long width, long height, String limit) {
        super("Rectified output " + width + "x" + height + " exceeds " + limit);
    }
}
