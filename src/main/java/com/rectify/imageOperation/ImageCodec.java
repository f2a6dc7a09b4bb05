package com.rectify.imageOperation;

import com.rectify.error.DecodeFailureException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

/**
 * Compressed bytes <-> {@link RawPixelBuffer}, backed by OpenCV imgcodecs.
 * Decoding always yields 3-channel BGR.
 */
@Slf4j
public class ImageCodec {

    private final long maxSourcePixels;

    public ImageCodec() {
        this(Integer.MAX_VALUE);
    }

    public ImageCodec(long maxSourcePixels) {
        this.maxSourcePixels = maxSourcePixels;
    }

    public RawPixelBuffer decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new DecodeFailureException("Image payload is empty");
        }
        Mat raw = new Mat(1, encoded.length, CV_8UC1);
        raw.data().put(encoded, 0, encoded.length);
        Mat image = null;
        try {
            try {
                image = imdecode(raw, IMREAD_COLOR);
            } catch (RuntimeException e) {
                throw new DecodeFailureException("Image bytes could not be decoded: " + e.getMessage(), e);
            }
            if (image == null || image.empty()) {
                throw new DecodeFailureException("Image bytes could not be decoded (" + encoded.length + " bytes)");
            }
            int width = image.cols();
            int height = image.rows();
            int channels = image.channels();

            if ((long) width * height > maxSourcePixels) {
                throw new DecodeFailureException("Decoded image " + width + "x" + height
                        + " exceeds the limit of " + maxSourcePixels + " pixels");
            }
            int length;
            try {
                length = Math.multiplyExact(Math.multiplyExact(width, height), channels);
            } catch (ArithmeticException e) {
                throw new DecodeFailureException("Decoded image " + width + "x" + height + "x" + channels
                        + " is too large to buffer", e);
            }
            // imdecode always allocates a continuous matrix
            byte[] pixels = new byte[length];
            image.data().get(pixels, 0, pixels.length);

            log.debug("Decoded {} bytes into {}x{}x{}", encoded.length, width, height, channels);
            return new RawPixelBuffer(width, height, channels, pixels);
        } finally {
            raw.release();
            if (image != null) image.release();
        }
    }

    /**
     * @param quality JPEG quality, 0..100
     */
    public byte[] encodeJpeg(RawPixelBuffer buffer, int quality) {
        Mat image = new Mat(buffer.getHeight(), buffer.getWidth(), CV_8UC(buffer.getChannels()));
        BytePointer out = new BytePointer();
        IntPointer params = new IntPointer(IMWRITE_JPEG_QUALITY, quality);
        try {
            image.data().put(buffer.getData(), 0, buffer.getData().length);
            if (!imencode(".jpg", image, out, params)) {
                throw new IllegalStateException("JPEG encoding failed for "
                        + buffer.getWidth() + "x" + buffer.getHeight());
            }
            byte[] jpeg = new byte[(int) out.capacity()];
            out.get(jpeg);
            return jpeg;
        } finally {
            image.release();
            out.deallocate();
            params.deallocate();
        }
    }
}
