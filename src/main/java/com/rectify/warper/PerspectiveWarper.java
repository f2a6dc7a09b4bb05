package com.rectify.warper;

import com.rectify.error.RectificationException;
import com.rectify.error.RectificationTimeoutException;
import com.rectify.geometry.OutputDimensions;
import com.rectify.homography.HomographyMatrix;
import com.rectify.imageOperation.RawPixelBuffer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Inverse-mapping resampler. Every output pixel is mapped back through the
 * output-to-source homography and bilinearly sampled from the source buffer.
 * <p>
 * Output rows are split into contiguous bands, one task per band. The source is only
 * read and each task writes its own rows, so no locking is needed.
 */
@Slf4j
public class PerspectiveWarper {

    private final ExecutorService workers;
    private final int parallelism;

    public PerspectiveWarper(ExecutorService workers, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.workers = workers;
        this.parallelism = parallelism;
    }

    /**
     * @param inverse homography from output pixel coordinates to source pixel coordinates
     * @param timeout time left for this request; unfinished bands are cancelled when it runs out
     */
    public RawPixelBuffer warp(RawPixelBuffer src, HomographyMatrix inverse, OutputDimensions dims, Duration timeout) {
        if (dims.isEmpty()) {
            throw new IllegalArgumentException("Output dimensions must be positive, got " + dims);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw outOfTime(timeout);
        }

        RawPixelBuffer dst = RawPixelBuffer.allocate(dims.getWidth(), dims.getHeight(), src.getChannels());
        double[] h = inverse.toArray();

        int bands = Math.min(parallelism, dims.getHeight());
        int rowsPerBand = (dims.getHeight() + bands - 1) / bands;
        List<Callable<Void>> tasks = new ArrayList<>(bands);
        for (int start = 0; start < dims.getHeight(); start += rowsPerBand) {
            int from = start;
            int to = Math.min(start + rowsPerBand, dims.getHeight());
            tasks.add(() -> {
                warpRows(src, h, dst, from, to);
                return null;
            });
        }

        List<Future<Void>> futures;
        try {
            futures = workers.invokeAll(tasks, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RectificationException("Interrupted while warping", e);
        }

        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (CancellationException e) {
                throw outOfTime(timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RectificationException("Interrupted while warping", e);
            } catch (ExecutionException e) {
                throw new RectificationException("Warp band failed: " + e.getCause().getMessage(), e.getCause());
            }
        }
        log.debug("Warped {}x{} in {} band(s)", dims.getWidth(), dims.getHeight(), tasks.size());
        return dst;
    }

    private static RectificationTimeoutException outOfTime(Duration remaining) {
        return new RectificationTimeoutException("Warp ran past the request deadline ("
                + Math.max(0, remaining.toMillis()) + " ms were left when it started)");
    }

    /**
     * Fills output rows {@code [fromRow, toRow)}. Pixels whose source neighbourhood
     * leaves the source image stay zero.
     */
    static void warpRows(RawPixelBuffer src, double[] h, RawPixelBuffer dst, int fromRow, int toRow) {
        int srcW = src.getWidth();
        int srcH = src.getHeight();
        int channels = src.getChannels();
        byte[] in = src.getData();
        byte[] out = dst.getData();
        int width = dst.getWidth();

        for (int oy = fromRow; oy < toRow; oy++) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            for (int ox = 0; ox < width; ox++) {
                double denom = h[6] * ox + h[7] * oy + h[8];
                double sx = (h[0] * ox + h[1] * oy + h[2]) / denom;
                double sy = (h[3] * ox + h[4] * oy + h[5]) / denom;

                double floorX = Math.floor(sx);
                double floorY = Math.floor(sy);
                // also rejects NaN and infinities
                if (!(floorX >= 0 && floorX + 1 < srcW && floorY >= 0 && floorY + 1 < srcH)) {
                    continue;
                }
                int x0 = (int) floorX;
                int y0 = (int) floorY;
                double fx = sx - x0;
                double fy = sy - y0;

                int i00 = (y0 * srcW + x0) * channels;
                int i10 = i00 + channels;
                int i01 = i00 + srcW * channels;
                int i11 = i01 + channels;
                int o = (oy * width + ox) * channels;

                for (int c = 0; c < channels; c++) {
                    int v00 = in[i00 + c] & 0xFF;
                    int v10 = in[i10 + c] & 0xFF;
                    int v01 = in[i01 + c] & 0xFF;
                    int v11 = in[i11 + c] & 0xFF;
                    double top = v00 + (v10 - v00) * fx;
                    double bot = v01 + (v11 - v01) * fx;
                    long value = Math.round(top + (bot - top) * fy);
                    out[o + c] = (byte) Math.max(0, Math.min(255, value));
                }
            }
        }
    }
}
