package com.rectify.API;

import com.rectify.API.dto.CornerPoint;
import com.rectify.API.dto.RectifyRequest;
import com.rectify.API.dto.RectifyResponse;
import com.rectify.config.RectifyProperties;
import com.rectify.error.DegenerateGeometryException;
import com.rectify.error.InvalidInputException;
import com.rectify.error.OutputTooLargeException;
import com.rectify.error.RectificationTimeoutException;
import com.rectify.geometry.CornerNormalizer;
import com.rectify.geometry.OutputDimensionEstimator;
import com.rectify.geometry.OutputDimensions;
import com.rectify.geometry.Point2D;
import com.rectify.geometry.Quadrilateral;
import com.rectify.geometry.QuadrilateralValidator;
import com.rectify.homography.HomographyMatrix;
import com.rectify.homography.HomographySolver;
import com.rectify.imageOperation.ImageCodec;
import com.rectify.imageOperation.RawPixelBuffer;
import com.rectify.warper.PerspectiveWarper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * One rectification request: decode, normalize, validate, estimate, solve, warp, encode.
 * Holds no per-request state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RectifyService {

    private static final String DATA_URL_PREFIX = "^data:image/[\\w.+-]+;base64,";

    private final ImageCodec imageCodec;
    private final CornerNormalizer cornerNormalizer;
    private final QuadrilateralValidator quadrilateralValidator;
    private final OutputDimensionEstimator dimensionEstimator;
    private final HomographySolver homographySolver;
    private final PerspectiveWarper perspectiveWarper;
    private final RectifyProperties properties;

    public RectifyResponse rectify(RectifyRequest request) {
        long startNanos = System.nanoTime();

        byte[] imageBytes = decodeBase64(request.getImageBase64());
        List<Point2D> points = toPoints(request.getCorners());
        Quadrilateral requested = cornerNormalizer.normalize(points);

        RawPixelBuffer source = imageCodec.decode(imageBytes);
        Quadrilateral quad = toSourcePixels(requested, request, source);
        quadrilateralValidator.validate(quad);

        OutputDimensions dims = dimensionEstimator.estimate(quad);
        checkOutputLimits(dims);

        // maps output pixels back into the source, which is the direction the warp reads
        HomographyMatrix inverse = homographySolver.solve(Quadrilateral.rectangle(dims), quad);

        RawPixelBuffer rectified = perspectiveWarper.warp(source, inverse, dims, remaining(startNanos));
        byte[] jpeg = imageCodec.encodeJpeg(rectified, properties.getJpegQuality());

        log.info("Rectified {}x{} source into {}x{} ({} ms)", source.getWidth(), source.getHeight(),
                dims.getWidth(), dims.getHeight(), (System.nanoTime() - startNanos) / 1_000_000);
        return new RectifyResponse(Base64.getEncoder().encodeToString(jpeg), dims.getWidth(), dims.getHeight());
    }

    static byte[] decodeBase64(String imageBase64) {
        if (imageBase64 == null || imageBase64.isBlank()) {
            throw new InvalidInputException("imageBase64 is required");
        }
        String clean = imageBase64.trim().replaceFirst(DATA_URL_PREFIX, "").replaceAll("\\s", "");
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(clean);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("imageBase64 is not valid base64: " + e.getMessage(), e);
        }
        if (bytes.length == 0) {
            throw new InvalidInputException("imageBase64 is empty");
        }
        return bytes;
    }

    static List<Point2D> toPoints(List<CornerPoint> corners) {
        if (corners == null) {
            return List.of();
        }
        List<Point2D> points = new ArrayList<>(corners.size());
        for (int i = 0; i < corners.size(); i++) {
            CornerPoint c = corners.get(i);
            if (c == null || c.getX() == null || c.getY() == null
                    || !Double.isFinite(c.getX()) || !Double.isFinite(c.getY())) {
                throw new InvalidInputException("Corner " + i + " needs finite x and y");
            }
            points.add(new Point2D(c.getX(), c.getY()));
        }
        return points;
    }

    /**
     * Rescales the corners when they were picked on an image of a different size than the one decoded.
     */
    static Quadrilateral toSourcePixels(Quadrilateral quad, RectifyRequest request, RawPixelBuffer source) {
        Integer sw = request.getSourceWidth();
        Integer sh = request.getSourceHeight();
        if (sw == null || sh == null || sw <= 0 || sh <= 0) {
            return quad;
        }
        if (sw == source.getWidth() && sh == source.getHeight()) {
            return quad;
        }
        log.debug("Scaling corners from {}x{} to {}x{}", sw, sh, source.getWidth(), source.getHeight());
        return quad.scale((double) source.getWidth() / sw, (double) source.getHeight() / sh);
    }

    private void checkOutputLimits(OutputDimensions dims) {
        if (dims.isEmpty()) {
            throw new DegenerateGeometryException("Quadrilateral yields an empty output " + dims.getWidth()
                    + "x" + dims.getHeight());
        }
        int maxSide = properties.getMaxOutputSide();
        if (dims.getWidth() > maxSide || dims.getHeight() > maxSide) {
            throw new OutputTooLargeException(dims.getWidth(), dims.getHeight(), "the side limit of " + maxSide);
        }
        if (dims.pixelCount() > properties.getMaxOutputPixels()) {
            throw new OutputTooLargeException(dims.getWidth(), dims.getHeight(),
                    "the area limit of " + properties.getMaxOutputPixels() + " pixels");
        }
    }

    private Duration remaining(long startNanos) {
        Duration deadline = properties.getDeadline();
        Duration left = deadline.minusNanos(System.nanoTime() - startNanos);
        if (left.isNegative() || left.isZero()) {
            throw new RectificationTimeoutException(deadline);
        }
        return left;
    }
}
