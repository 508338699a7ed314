package com.sensor.anomaly.health;

import com.sensor.anomaly.exception.DependencyUnavailableException;
import com.sensor.anomaly.repository.SlidingWindowStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the window store as DOWN when it cannot be scanned, since the statistical stage
 * cannot classify without history. Exposed via /actuator/health.
 */
@Component
public class WindowStoreHealthIndicator implements HealthIndicator {

    private final SlidingWindowStore windowStore;

    public WindowStoreHealthIndicator(SlidingWindowStore windowStore) {
        this.windowStore = windowStore;
    }

    @Override
    public Health health() {
        try {
            int windows = windowStore.countByPattern("*");
            return Health.up()
                    .withDetail("sensorWindows", windows)
                    .withDetail("capacity", windowStore.capacity())
                    .build();
        } catch (DependencyUnavailableException e) {
            return Health.down()
                    .withDetail("dependency", e.getDependency())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
