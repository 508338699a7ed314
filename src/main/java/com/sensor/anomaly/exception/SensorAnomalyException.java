package com.sensor.anomaly.exception;

/**
 * Base exception for all sensor anomaly detection errors.
 */
public class SensorAnomalyException extends RuntimeException {

    public SensorAnomalyException(String message) {
        super(message);
    }

    public SensorAnomalyException(String message, Throwable cause) {
        super(message, cause);
    }
}
