package com.sensor.anomaly.engine.statistical;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.engine.SensorDetector;
import com.sensor.anomaly.enrichment.ContextEnricher;
import com.sensor.anomaly.model.AlarmResult;
import com.sensor.anomaly.model.AlarmType;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.SensorRecord;
import com.sensor.anomaly.model.WindowPoint;
import com.sensor.anomaly.repository.SlidingWindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Adaptive outlier detection: each variable is its own time series with a bounded window in
 * the shared store.
 *
 * <p>Per variable: append the value and get back the window as it was just before, in one
 * atomic store call, then classify the value against IQR fences of those <em>previous</em>
 * points only. The point being classified is never part of its own baseline, and concurrent
 * evaluations of one sensor (on this or another instance) each see all earlier points. With
 * fewer than {@code minDataPoints} prior points the value is OK unconditionally.
 *
 * <p>Variables within a record are independent and evaluated concurrently. A store failure is
 * not a classification: it propagates as
 * {@link com.sensor.anomaly.exception.DependencyUnavailableException}.
 *
 * <p>A record is not a transaction across sensors. When one sensor's store call fails, the
 * other sensors of the record have still been appended and the whole record is reported as
 * failed. Such a record must not be re-submitted as-is: the sensors that succeeded would be
 * appended twice and later points classified against a baseline holding the duplicate.
 */
@Component
public class StatisticalDetector implements SensorDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDetector.class);

    private final SlidingWindowStore windowStore;
    private final ContextEnricher contextEnricher;
    private final MetricsConfig metricsConfig;
    private final Executor executor;
    private final int minDataPoints;
    private final double iqrMultiplier;

    public StatisticalDetector(SlidingWindowStore windowStore,
                               ContextEnricher contextEnricher,
                               MetricsConfig metricsConfig,
                               DetectionConfig detectionConfig,
                               @Qualifier("statisticalExecutor") Executor executor) {
        this.windowStore = windowStore;
        this.contextEnricher = contextEnricher;
        this.metricsConfig = metricsConfig;
        this.executor = executor;
        this.minDataPoints = detectionConfig.getMinDataPoints();
        this.iqrMultiplier = detectionConfig.getIqrMultiplier();
        log.info("Statistical detector ready: window={}, minDataPoints={}, iqrMultiplier={}",
                windowStore.capacity(), minDataPoints, iqrMultiplier);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public Map<String, AlarmResult> evaluate(SensorRecord record) {
        Instant timestamp = record.getTimestamp();

        Map<String, CompletableFuture<AlarmResult>> pending = new LinkedHashMap<>();
        record.getData().forEach((sensor, value) -> pending.put(sensor,
                CompletableFuture.supplyAsync(() -> evaluateSensor(sensor, value, timestamp), executor)));

        Map<String, AlarmResult> results = new LinkedHashMap<>();
        RuntimeException failure = null;
        for (Map.Entry<String, CompletableFuture<AlarmResult>> entry : pending.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                // Keep draining so every in-flight append finishes before we surface the error
                if (failure == null) {
                    failure = unwrap(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    AlarmResult evaluateSensor(String sensor, double value, Instant timestamp) {
        List<WindowPoint> previous = windowStore.readAndAppend(sensor, timestamp, value);
        AlarmType alarm = classify(value, previous);

        AlarmResult result = AlarmResult.of(value, alarm);
        if (alarm.isAlarm()) {
            result.setContext(contextEnricher.enrich(sensor, alarm));
            metricsConfig.recordAlarm(getMethod().getTag(), alarm.getLabel());
        }
        return result;
    }

    /**
     * Classify {@code value} against the given prior window. Pure: depends only on the
     * arguments, which lets replays reproduce a classification from stored history.
     */
    public AlarmType classify(double value, List<WindowPoint> previous) {
        if (previous.isEmpty() || previous.size() < minDataPoints) {
            return AlarmType.OK;
        }
        double[] values = previous.stream().mapToDouble(WindowPoint::getValue).toArray();
        QuartileBand band = QuartileBand.of(values, iqrMultiplier);
        AlarmType alarm = band.classify(value);
        if (alarm.isAlarm()) {
            log.debug("Statistical alarm {} for value {} ({})", alarm.getLabel(), value, band);
        }
        return alarm;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
}
