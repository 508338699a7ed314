package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Aggregate verdict of the reconstruction model for a whole record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelResult {

    private Map<String, Double> values;

    private DetectionStatus status;

    // Null when status is ERROR
    private Double reconstructionError;

    private double threshold;

    @Builder.Default
    private List<String> missingFeatures = List.of();

    public boolean isAnomaly() {
        return status == DetectionStatus.ANOMALY;
    }
}
