package com.rectify.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "rectify")
public class RectifyProperties {

    private int jpegQuality = 85;

    private int maxOutputSide = 8000;

    private long maxOutputPixels = 40_000_000L;

    private long maxSourcePixels = 100_000_000L;

    // px^2 spanned by any three corners
    private double minTriangleArea = 1.0;

    private Duration deadline = Duration.ofSeconds(30);

    // 0 = one per available processor
    private int workerThreads = 0;

    private int maxImageChars = 60_000_000;

    public int resolvedWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
