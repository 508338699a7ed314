package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One multi-variable reading: an ISO-8601 timestamp and variable name to value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorRecord {

    private Instant timestamp;

    private Map<String, Double> data;
}
