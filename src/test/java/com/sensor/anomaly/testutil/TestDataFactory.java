package com.sensor.anomaly.testutil;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.model.ContextEntry;
import com.sensor.anomaly.model.SensorRecord;
import com.sensor.anomaly.model.ThresholdLimits;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private TestDataFactory() {}

    public static SensorRecord createRecord(Instant timestamp, Object... variableValuePairs) {
        Map<String, Double> data = new LinkedHashMap<>();
        for (int i = 0; i < variableValuePairs.length; i += 2) {
            data.put((String) variableValuePairs[i], ((Number) variableValuePairs[i + 1]).doubleValue());
        }
        return SensorRecord.builder()
                .timestamp(timestamp)
                .data(data)
                .build();
    }

    public static SensorRecord createRecord(Object... variableValuePairs) {
        return createRecord(T0, variableValuePairs);
    }

    public static ThresholdLimits createLimits(double lowLow, double low, double high, double highHigh) {
        return ThresholdLimits.builder()
                .lowLow(lowLow)
                .low(low)
                .high(high)
                .highHigh(highHigh)
                .build();
    }

    public static ContextEntry createContext(String cause, String actions) {
        return ContextEntry.builder()
                .cause(cause)
                .actions(actions)
                .build();
    }

    public static DetectionConfig createDetectionConfig(int windowSize, int minDataPoints) {
        DetectionConfig config = new DetectionConfig();
        config.setWindowSize(windowSize);
        config.setMinDataPoints(minDataPoints);
        config.setIqrMultiplier(1.5);
        config.getStoreRetry().setMaxAttempts(3);
        config.getStoreRetry().setInitialBackoffMs(0);
        config.getStoreRetry().setMaxBackoffMs(0);
        return config;
    }
}
