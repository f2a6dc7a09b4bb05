package com.rectify.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.rectify.geometry.CornerNormalizer;
import com.rectify.geometry.OutputDimensionEstimator;
import com.rectify.geometry.QuadrilateralValidator;
import com.rectify.homography.HomographySolver;
import com.rectify.imageOperation.ImageCodec;
import com.rectify.warper.PerspectiveWarper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(RectifyProperties.class)
public class RectifyConfig {

    @Bean
    public CornerNormalizer cornerNormalizer() {
        return new CornerNormalizer();
    }

    @Bean
    public QuadrilateralValidator quadrilateralValidator(RectifyProperties properties) {
        return new QuadrilateralValidator(properties.getMinTriangleArea());
    }

    @Bean
    public OutputDimensionEstimator outputDimensionEstimator() {
        return new OutputDimensionEstimator();
    }

    @Bean
    public HomographySolver homographySolver() {
        return new HomographySolver();
    }

    @Bean
    public ImageCodec imageCodec(RectifyProperties properties) {
        return new ImageCodec(properties.getMaxSourcePixels());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService warpExecutor(RectifyProperties properties) {
        int threads = properties.resolvedWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "warp-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("Warp pool: {} thread(s)", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public PerspectiveWarper perspectiveWarper(ExecutorService warpExecutor, RectifyProperties properties) {
        return new PerspectiveWarper(warpExecutor, properties.resolvedWorkerThreads());
    }

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer largePayloadCustomizer(RectifyProperties properties) {
        return builder -> builder.postConfigurer(mapper -> mapper.getFactory().setStreamReadConstraints(
                StreamReadConstraints.builder().maxStringLength(properties.getMaxImageChars()).build()));
    }
}
