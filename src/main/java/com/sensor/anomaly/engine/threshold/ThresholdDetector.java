package com.sensor.anomaly.engine.threshold;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.engine.SensorDetector;
import com.sensor.anomaly.enrichment.ContextEnricher;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import com.sensor.anomaly.model.AlarmResult;
import com.sensor.anomaly.model.AlarmType;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.SensorRecord;
import com.sensor.anomaly.model.ThresholdLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classifies each variable against static four-level limits.
 *
 * <pre>
 *   value &lt;  LowLow            -&gt; Low-Low
 *   LowLow &lt;= value &lt; Low      -&gt; Low
 *   Low &lt;= value &lt;= High       -&gt; OK
 *   High &lt; value &lt;= HighHigh   -&gt; High
 *   value &gt;  HighHigh          -&gt; High-High
 * </pre>
 *
 * The boundaries are asymmetric: both Low and High themselves are OK.
 *
 * <p>Variables that have no limits configured are classified OK/Normal. A reading from an
 * unconfigured instrument is not evidence of a fault.
 */
@Component
public class ThresholdDetector implements SensorDetector {

    private static final Logger log = LoggerFactory.getLogger(ThresholdDetector.class);

    private final ThresholdSet thresholds;
    private final ContextEnricher contextEnricher;
    private final MetricsConfig metricsConfig;

    public ThresholdDetector(ThresholdSet thresholds, ContextEnricher contextEnricher,
                             MetricsConfig metricsConfig) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new DetectorConfigurationException("thresholds", "threshold configuration is missing");
        }
        this.thresholds = thresholds;
        this.contextEnricher = contextEnricher;
        this.metricsConfig = metricsConfig;

        for (String variable : thresholds.variables()) {
            ThresholdLimits limits = thresholds.get(variable);
            if (limits == null || !limits.isComplete()) {
                throw new DetectorConfigurationException("thresholds",
                        "incomplete limits for variable " + variable + ": " + limits);
            }
            if (!limits.isOrdered()) {
                log.warn("Limits for {} are not ordered LowLow <= Low <= High <= HighHigh: {}",
                        variable, limits);
            }
        }
        log.info("Threshold detector ready with limits for {} variables", thresholds.size());
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.HEURISTIC;
    }

    @Override
    public Map<String, AlarmResult> evaluate(SensorRecord record) {
        Map<String, AlarmResult> results = new LinkedHashMap<>();

        record.getData().forEach((variable, value) -> {
            ThresholdLimits limits = thresholds.get(variable);
            AlarmType alarm = limits != null ? classify(value, limits) : AlarmType.OK;
            AlarmResult result = AlarmResult.of(value, alarm);

            if (alarm.isAlarm()) {
                result.setContext(contextEnricher.enrich(variable, alarm));
                metricsConfig.recordAlarm(getMethod().getTag(), alarm.getLabel());
                log.debug("Threshold alarm {} for {}={} (limits {})", alarm.getLabel(), variable, value, limits);
            }
            results.put(variable, result);
        });

        return results;
    }

    static AlarmType classify(double value, ThresholdLimits limits) {
        if (value < limits.getLowLow()) {
            return AlarmType.LOW_LOW;
        }
        if (value < limits.getLow()) {
            return AlarmType.LOW;
        }
        if (value <= limits.getHigh()) {
            return AlarmType.OK;
        }
        if (value <= limits.getHighHigh()) {
            return AlarmType.HIGH;
        }
        return AlarmType.HIGH_HIGH;
    }
}
