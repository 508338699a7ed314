package com.sensor.anomaly.exception;

public class InvalidRecordException extends SensorAnomalyException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
