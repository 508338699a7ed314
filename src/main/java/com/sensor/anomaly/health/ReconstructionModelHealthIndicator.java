package com.sensor.anomaly.health;

import com.sensor.anomaly.engine.reconstruction.ReconstructionModelDetector;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ReconstructionModelHealthIndicator implements HealthIndicator {

    private final ReconstructionModelDetector modelDetector;

    public ReconstructionModelHealthIndicator(ReconstructionModelDetector modelDetector) {
        this.modelDetector = modelDetector;
    }

    // The detector only exists once every artifact loaded, so reaching here means UP
    @Override
    public Health health() {
        return Health.up().withDetails(modelDetector.describe()).build();
    }
}
