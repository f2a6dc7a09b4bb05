package com.rectify.imageOperation;

import lombok.Getter;

/**
 * Row-major, channel-interleaved 8-bit image. Channel order is whatever the codec produced (BGR for OpenCV).
 */
@Getter
public class RawPixelBuffer {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    public RawPixelBuffer(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0 || channels <= 0) {
            throw new IllegalArgumentException("Invalid buffer shape " + width + "x" + height + "x" + channels);
        }
        long expected = (long) width * height * channels;
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException("Buffer of " + width + "x" + height + "x" + channels
                    + " needs " + expected + " bytes, got " + (data == null ? 0 : data.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    public static RawPixelBuffer allocate(int width, int height, int channels) {
        return new RawPixelBuffer(width, height, channels, new byte[Math.multiplyExact(Math.multiplyExact(width, height), channels)]);
    }

    public int offset(int x, int y) {
        return (y * width + x) * channels;
    }

    public int sample(int x, int y, int channel) {
        return data[offset(x, y) + channel] & 0xFF;
    }
}
