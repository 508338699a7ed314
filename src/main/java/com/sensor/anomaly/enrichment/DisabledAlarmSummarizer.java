package com.sensor.anomaly.enrichment;

import com.sensor.anomaly.model.ContextEntry;

import java.util.Optional;

public class DisabledAlarmSummarizer implements AlarmSummarizer {

    @Override
    public Optional<String> summarize(String variable, String alarmLabel, ContextEntry context) {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
