package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDetectionResponse {

    private Instant timestamp;

    @Builder.Default
    private DetectionMethod method = DetectionMethod.ML;

    private ModelResult result;

    private double processingTimeMs;
}
