package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionStatus {
    NORMAL("Normal"),
    ANOMALY("Anomaly"),
    // Malformed input, never an anomalous reading
    ERROR("Error");

    private final String label;

    DetectionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
