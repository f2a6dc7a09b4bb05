package com.rectify.error;

import lombok.Getter;

@Getter
public class InvalidCornerCountException extends InvalidInputException {

    private final int actualCount;

    public InvalidCornerCountException(int actualCount) {
        super("Exactly 4 corners are required (top-left, top-right, bottom-right, bottom-left), got " + actualCount);
        this.actualCount = actualCount;
    }
}
