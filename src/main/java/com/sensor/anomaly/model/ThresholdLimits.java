package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static four-level limits for one variable. All four levels are required; a level left out of
 * the configuration stays null and is rejected at load. LowLow <= Low <= High <= HighHigh is
 * expected but not enforced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdLimits {

    @JsonProperty("Low-Low")
    private Double lowLow;

    @JsonProperty("Low")
    private Double low;

    @JsonProperty("High")
    private Double high;

    @JsonProperty("High-High")
    private Double highHigh;

    public boolean isComplete() {
        return lowLow != null && low != null && high != null && highHigh != null;
    }

    public boolean isOrdered() {
        return lowLow <= low && low <= high && high <= highHigh;
    }
}
