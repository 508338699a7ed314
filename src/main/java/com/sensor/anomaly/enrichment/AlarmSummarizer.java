package com.sensor.anomaly.enrichment;

import com.sensor.anomaly.model.ContextEntry;

import java.util.Optional;

/**
 * Turns a structured context entry into a short operator-facing sentence. Best effort:
 * implementations return empty rather than throw when the backing service fails or times out.
 */
public interface AlarmSummarizer {

    Optional<String> summarize(String variable, String alarmLabel, ContextEntry context);

    boolean isEnabled();
}
