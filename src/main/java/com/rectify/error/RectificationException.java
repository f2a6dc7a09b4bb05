package com.rectify.error;

public class RectificationException extends RuntimeException {

    public RectificationException(String message) {
        super(message);
    }

    public RectificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
