package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of the orchestrated run. Stages after a threshold anomaly are null
 * because they were never invoked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResponse {

    private Instant timestamp;

    @Builder.Default
    private DetectionMethod method = DetectionMethod.PIPELINE;

    // Last stage that actually ran
    private DetectionMethod finalStage;

    private DetectionStatus status;

    private DetectionResponse threshold;

    private DetectionResponse statistical;

    private ModelDetectionResponse model;

    private double processingTimeMs;

    public boolean isShortCircuited() {
        return finalStage == DetectionMethod.HEURISTIC;
    }
}
