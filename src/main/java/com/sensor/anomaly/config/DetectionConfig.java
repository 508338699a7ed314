package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Maximum number of points kept per sensor window (FIFO eviction beyond this).
    private int windowSize = 100;

    // Below this many prior points a sensor is always classified OK.
    private int minDataPoints = 4;

    // Tukey fence multiplier applied to the IQR.
    private double iqrMultiplier = 1.5;

    // Resource locations (Spring resource syntax, e.g. classpath: or file:).
    private String thresholdsPath = "classpath:data/thresholds.json";
    private String contextPath = "classpath:data/alarm_context.json";
    private String modelPath = "classpath:data/model";

    private Statistical statistical = new Statistical();

    private Retry storeRetry = new Retry();

    @Data
    public static class Statistical {
        // Sensors of one record evaluated in parallel; 1 means sequential.
        private int parallelism = 4;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 50;
        private long maxBackoffMs = 500;
    }
}
