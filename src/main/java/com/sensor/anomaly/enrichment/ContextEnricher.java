package com.sensor.anomaly.enrichment;

import com.sensor.anomaly.model.AlarmType;
import com.sensor.anomaly.model.ContextEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Attaches explanation text to an alarm.
 *
 * <ul>
 *   <li>no corpus entry: empty string</li>
 *   <li>entry and a summary: the summary</li>
 *   <li>entry but no summary (disabled, failed, timed out, blank): "Cause: .. Actions: .."</li>
 * </ul>
 * Never throws; classification must not depend on enrichment.
 */
@Component
public class ContextEnricher {

    private static final Logger log = LoggerFactory.getLogger(ContextEnricher.class);

    private final AlarmContextCatalog catalog;
    private final AlarmSummarizer summarizer;

    public ContextEnricher(AlarmContextCatalog catalog, AlarmSummarizer summarizer) {
        this.catalog = catalog;
        this.summarizer = summarizer;
    }

    public String enrich(String variable, AlarmType alarm) {
        if (!alarm.isAlarm()) {
            return "";
        }

        Optional<ContextEntry> entry = catalog.lookup(variable, alarm.getLabel());
        if (entry.isEmpty()) {
            return "";
        }

        try {
            Optional<String> summary = summarizer.summarize(variable, alarm.getLabel(), entry.get());
            if (summary.isPresent() && !summary.get().isBlank()) {
                return summary.get();
            }
        } catch (RuntimeException e) {
            log.warn("Summarizer failed for {} {}, using structured context: {}",
                    variable, alarm.getLabel(), e.getMessage());
        }
        return entry.get().toFallbackText();
    }
}
