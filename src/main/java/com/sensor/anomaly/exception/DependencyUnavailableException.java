package com.sensor.anomaly.exception;

/**
 * An external dependency (window store, summarizer) timed out or stayed unreachable
 * after bounded retries.
 */
public class DependencyUnavailableException extends SensorAnomalyException {

    private final String dependency;
    private final int attempts;

    public DependencyUnavailableException(String dependency, int attempts, Throwable cause) {
        super(String.format("%s unavailable after %d attempt(s): %s",
                dependency, attempts, cause != null ? cause.getMessage() : "unknown"), cause);
        this.dependency = dependency;
        this.attempts = attempts;
    }

    public String getDependency() {
        return dependency;
    }

    public int getAttempts() {
        return attempts;
    }
}
