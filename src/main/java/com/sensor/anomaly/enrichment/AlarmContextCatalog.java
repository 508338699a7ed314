package com.sensor.anomaly.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import com.sensor.anomaly.model.ContextEntry;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only corpus of cause/action text keyed by variable and alarm label, e.g.
 * {@code {"INJECTION_PRESSURE": {"High": {"Cause": "...", "Actions": "..."}}}}.
 */
public final class AlarmContextCatalog {

    private final Map<String, Map<String, ContextEntry>> entries;

    public AlarmContextCatalog(Map<String, Map<String, ContextEntry>> entries) {
        Map<String, Map<String, ContextEntry>> copy = new HashMap<>();
        entries.forEach((variable, byAlarm) -> copy.put(variable, Map.copyOf(byAlarm)));
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static AlarmContextCatalog read(InputStream in, ObjectMapper objectMapper, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new DetectorConfigurationException(source, "unreadable alarm context corpus", e);
        }
        if (root == null || !root.isObject()) {
            throw new DetectorConfigurationException(source, "alarm context corpus must be a JSON object");
        }

        Map<String, Map<String, ContextEntry>> entries = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> variables = root.fields();
        while (variables.hasNext()) {
            Map.Entry<String, JsonNode> variable = variables.next();
            if (!variable.getValue().isObject()) {
                continue;
            }
            Map<String, ContextEntry> byAlarm = new HashMap<>();
            variable.getValue().fields().forEachRemaining(alarm -> {
                JsonNode bucket = alarm.getValue();
                if (bucket.isObject()) {
                    byAlarm.put(alarm.getKey(), ContextEntry.builder()
                            .cause(clean(bucket.path("Cause").asText("")))
                            .actions(clean(bucket.path("Actions").asText("")))
                            .build());
                }
            });
            entries.put(variable.getKey(), byAlarm);
        }
        return new AlarmContextCatalog(entries);
    }

    public Optional<ContextEntry> lookup(String variable, String alarmLabel) {
        Map<String, ContextEntry> byAlarm = entries.get(variable);
        if (byAlarm == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byAlarm.get(alarmLabel));
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }

    static String clean(String text) {
        return text == null ? "" : text.strip().replaceAll("\\s+", " ");
    }
}
