package com.rectify.error;

import java.time.Duration;

public class RectificationTimeoutException extends RectificationException {

    public RectificationTimeoutException(Duration deadline) {
        super("Rectification did not finish within " + deadline.toMillis() + " ms");
    }

    public RectificationTimeoutException(String message) {
        super(message);
    }
}
