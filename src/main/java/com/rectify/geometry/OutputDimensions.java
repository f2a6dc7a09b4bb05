package com.rectify.geometry;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class OutputDimensions {
    private final int width;
    private final int height;

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
