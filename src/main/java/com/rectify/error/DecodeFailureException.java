package com.rectify.error;

public class DecodeFailureException extends RectificationException {

    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
