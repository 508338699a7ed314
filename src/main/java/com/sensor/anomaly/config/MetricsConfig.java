package com.sensor.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(String method, String status, long durationNanos) {
        Counter.builder("detection.count")
                .tag("method", method)
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.duration")
                .tag("method", method)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordAlarm(String method, String alarmType) {
        Counter.builder("detection.alarm.count")
                .tag("method", method)
                .tag("alarm_type", alarmType)
                .register(registry)
                .increment();
    }

    public void recordShortCircuit() {
        Counter.builder("pipeline.short_circuit.count")
                .register(registry)
                .increment();
    }

    public void recordSummarizer(String outcome) {
        Counter.builder("summarizer.request.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStoreFailure(String operation) {
        Counter.builder("window_store.failure.count")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
