package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    HEURISTIC("heuristic"),
    STATISTICAL("statistical"),
    ML("ml"),
    PIPELINE("pipeline");

    private final String tag;

    DetectionMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
