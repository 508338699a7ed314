package com.sensor.anomaly.exception;

/**
 * Raised at startup when a detector cannot be built from its configuration or artifacts
 * (thresholds, model files, context corpus, summarizer credentials). The owning detector
 * never becomes ready with partial state.
 */
public class DetectorConfigurationException extends SensorAnomalyException {

    private final String resource;

    public DetectorConfigurationException(String resource, String message) {
        super(String.format("%s: %s", resource, message));
        this.resource = resource;
    }

    public DetectorConfigurationException(String resource, String message, Throwable cause) {
        super(String.format("%s: %s", resource, message), cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
