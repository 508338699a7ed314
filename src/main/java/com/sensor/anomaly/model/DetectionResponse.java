package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Per-variable results of a single detection stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResponse {

    private Instant timestamp;

    private DetectionMethod method;

    private Map<String, AlarmResult> results;

    private double processingTimeMs;

    public boolean hasAnomaly() {
        return results != null && results.values().stream().anyMatch(AlarmResult::isAnomaly);
    }
}
