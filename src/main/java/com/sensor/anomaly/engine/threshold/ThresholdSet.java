package com.sensor.anomaly.engine.threshold;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import com.sensor.anomaly.model.ThresholdLimits;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable variable to four-level limits mapping, loaded once at startup.
 */
public final class ThresholdSet {

    private final Map<String, ThresholdLimits> limits;

    public ThresholdSet(Map<String, ThresholdLimits> limits) {
        this.limits = Collections.unmodifiableMap(new LinkedHashMap<>(limits));
    }

    /**
     * Parse {@code {"VAR": {"Low-Low": .., "Low": .., "High": .., "High-High": ..}}}.
     */
    public static ThresholdSet read(InputStream in, ObjectMapper objectMapper, String source) {
        Map<String, ThresholdLimits> parsed;
        try {
            parsed = objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, ThresholdLimits>>() {});
        } catch (IOException e) {
            throw new DetectorConfigurationException(source, "unreadable threshold file", e);
        }
        if (parsed == null || parsed.isEmpty()) {
            throw new DetectorConfigurationException(source, "no thresholds defined");
        }
        parsed.forEach((variable, value) -> {
            if (value == null) {
                throw new DetectorConfigurationException(source, "null limits for variable " + variable);
            }
            if (!value.isComplete()) {
                throw new DetectorConfigurationException(source, "limits for variable " + variable
                        + " must define Low-Low, Low, High and High-High: " + value);
            }
        });
        return new ThresholdSet(parsed);
    }

    public ThresholdLimits get(String variable) {
        return limits.get(variable);
    }

    public boolean contains(String variable) {
        return limits.containsKey(variable);
    }

    public Set<String> variables() {
        return limits.keySet();
    }

    public boolean isEmpty() {
        return limits.isEmpty();
    }

    public int size() {
        return limits.size();
    }
}
