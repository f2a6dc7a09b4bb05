package com.rectify.API;

import com.rectify.API.dto.CornerPoint;
import com.rectify.API.dto.RectifyRequest;
import com.rectify.API.dto.RectifyResponse;
import com.rectify.config.RectifyProperties;
import com.rectify.error.DecodeFailureException;
import com.rectify.error.DegenerateGeometryException;
import com.rectify.error.InvalidCornerCountException;
import com.rectify.error.InvalidInputException;
import com.rectify.error.OutputTooLargeException;
import com.rectify.geometry.CornerNormalizer;
import com.rectify.geometry.OutputDimensionEstimator;
import com.rectify.geometry.QuadrilateralValidator;
import com.rectify.homography.HomographySolver;
import com.rectify.imageOperation.ImageCodec;
import com.rectify.imageOperation.RawPixelBuffer;
import com.rectify.warper.PerspectiveWarper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class RectifyServiceTest {

    private static final List<CornerPoint> POSTCARD = Arrays.asList(
            new CornerPoint(50.0, 60.0), new CornerPoint(350.0, 40.0),
            new CornerPoint(360.0, 280.0), new CornerPoint(40.0, 260.0));

    private final ImageCodec codec = new ImageCodec();
    private ExecutorService pool;
    private RectifyProperties properties;
    private RectifyService service;
    private String sourceBase64;

    @BeforeEach
    public void setUp() {
        pool = Executors.newFixedThreadPool(2);
        properties = new RectifyProperties();
        service = newService();
        sourceBase64 = Base64.getEncoder().encodeToString(codec.encodeJpeg(postcardImage(400, 300), 90));
    }

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
    }

    private RectifyService newService() {
        return new RectifyService(codec, new CornerNormalizer(),
                new QuadrilateralValidator(properties.getMinTriangleArea()),
                new OutputDimensionEstimator(), new HomographySolver(),
                new PerspectiveWarper(pool, 2), properties);
    }

    @Test
    public void rectifiesSkewedPostcard() {
        RectifyResponse response = service.rectify(new RectifyRequest(sourceBase64, POSTCARD, null, null));

        assertEquals(321, response.getWidth());
        assertEquals(240, response.getHeight());
        RawPixelBuffer out = codec.decode(Base64.getDecoder().decode(response.getImageBase64()));
        assertEquals(321, out.getWidth());
        assertEquals(240, out.getHeight());
        assertTrue(out.sample(160, 120, 1) > 100, "centre should come from the bright card");
    }

    @Test
    public void acceptsDataUrlPrefix() {
        String dataUrl = "data:image/jpeg;base64," + sourceBase64;
        RectifyResponse response = service.rectify(new RectifyRequest(dataUrl, POSTCARD, null, null));

        assertEquals(321, response.getWidth());
    }

    @Test
    public void scalesCornersPickedOnSmallerPreview() {
        List<CornerPoint> preview = Arrays.asList(
                new CornerPoint(25.0, 30.0), new CornerPoint(175.0, 20.0),
                new CornerPoint(180.0, 140.0), new CornerPoint(20.0, 130.0));

        RectifyResponse response = service.rectify(new RectifyRequest(sourceBase64, preview, 200, 150));

        assertEquals(321, response.getWidth());
        assertEquals(240, response.getHeight());
    }

    @Test
    public void matchingSourceSizeLeavesCornersAlone() {
        RectifyResponse response = service.rectify(new RectifyRequest(sourceBase64, POSTCARD, 400, 300));

        assertEquals(321, response.getWidth());
        assertEquals(240, response.getHeight());
    }

    @Test
    public void missingImageIsInvalidInput() {
        assertThrows(InvalidInputException.class,
                () -> service.rectify(new RectifyRequest(null, POSTCARD, null, null)));
        assertThrows(InvalidInputException.class,
                () -> service.rectify(new RectifyRequest("   ", POSTCARD, null, null)));
    }

    @Test
    public void badBase64IsInvalidInput() {
        assertThrows(InvalidInputException.class,
                () -> service.rectify(new RectifyRequest("@@not-base64@@", POSTCARD, null, null)));
    }

    @Test
    public void wrongCornerCountIsInvalidInput() {
        assertThrows(InvalidCornerCountException.class,
                () -> service.rectify(new RectifyRequest(sourceBase64, POSTCARD.subList(0, 3), null, null)));
        assertThrows(InvalidCornerCountException.class,
                () -> service.rectify(new RectifyRequest(sourceBase64, null, null, null)));
    }

    @Test
    public void cornerWithoutCoordinateIsInvalidInput() {
        List<CornerPoint> corners = Arrays.asList(
                new CornerPoint(50.0, 60.0), new CornerPoint(null, 40.0),
                new CornerPoint(360.0, 280.0), new CornerPoint(40.0, 260.0));

        assertThrows(InvalidInputException.class,
                () -> service.rectify(new RectifyRequest(sourceBase64, corners, null, null)));
    }

    @Test
    public void undecodableImageIsDecodeFailure() {
        String text = Base64.getEncoder().encodeToString("hello postcard".getBytes(StandardCharsets.UTF_8));

        assertThrows(DecodeFailureException.class,
                () -> service.rectify(new RectifyRequest(text, POSTCARD, null, null)));
    }

    @Test
    public void collinearCornersAreDegenerate() {
        List<CornerPoint> corners = Arrays.asList(
                new CornerPoint(0.0, 0.0), new CornerPoint(100.0, 0.0),
                new CornerPoint(200.0, 0.0), new CornerPoint(0.0, 100.0));

        assertThrows(DegenerateGeometryException.class,
                () -> service.rectify(new RectifyRequest(sourceBase64, corners, null, null)));
    }

    @Test
    public void oversizedOutputIsRefusedBeforeWarping() {
        properties.setMaxOutputSide(300);
        RectifyService strict = newService();

        assertThrows(OutputTooLargeException.class,
                () -> strict.rectify(new RectifyRequest(sourceBase64, POSTCARD, null, null)));
    }

    @Test
    public void oversizedAreaIsRefused() {
        properties.setMaxOutputPixels(321L * 240 - 1);
        RectifyService strict = newService();

        assertThrows(OutputTooLargeException.class,
                () -> strict.rectify(new RectifyRequest(sourceBase64, POSTCARD, null, null)));
    }

    @Test
    public void edgeLongerThanIntRangeIsTooLarge() {
        double far = 4294967296.0 + 500;
        List<CornerPoint> corners = Arrays.asList(
                new CornerPoint(0.0, 0.0), new CornerPoint(far, 0.0),
                new CornerPoint(far, 300.0), new CornerPoint(0.0, 300.0));

        assertThrows(OutputTooLargeException.class,
                () -> service.rectify(new RectifyRequest(sourceBase64, corners, null, null)));
    }

    /**
     * Dark background with a bright card where the postcard corners are.
     */
    static RawPixelBuffer postcardImage(int width, int height) {
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean card = x > 60 && x < 340 && y > 70 && y < 250;
                int v = card ? 220 : 20;
                int o = (y * width + x) * 3;
                data[o] = (byte) v;
                data[o + 1] = (byte) v;
                data[o + 2] = (byte) v;
            }
        }
        return new RawPixelBuffer(width, height, 3, data);
    }
}
