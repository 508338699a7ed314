package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction and severity of a deviation. Serialized by label ("Low-Low", "High-High", ...),
 * which is also the key used by the alarm context corpus.
 */
public enum AlarmType {
    OK("OK"),
    LOW("Low"),
    LOW_LOW("Low-Low"),
    HIGH("High"),
    HIGH_HIGH("High-High");

    private final String label;

    AlarmType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isAlarm() {
        return this != OK;
    }

    public DetectionStatus toStatus() {
        return isAlarm() ? DetectionStatus.ANOMALY : DetectionStatus.NORMAL;
    }

    @JsonCreator
    public static AlarmType fromLabel(String label) {
        for (AlarmType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alarm type: " + label);
    }
}
