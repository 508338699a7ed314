package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Human-authored cause and operator actions for one variable/alarm combination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextEntry {

    @JsonProperty("Cause")
    private String cause;

    @JsonProperty("Actions")
    private String actions;

    /**
     * Deterministic text used when no summary could be produced.
     */
    public String toFallbackText() {
        return String.format("Cause: %s. Actions: %s",
                cause != null ? cause : "", actions != null ? actions : "");
    }
}
