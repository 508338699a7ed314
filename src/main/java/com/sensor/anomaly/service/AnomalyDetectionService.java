package com.sensor.anomaly.service;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.engine.SensorDetector;
import com.sensor.anomaly.engine.reconstruction.ReconstructionModelDetector;
import com.sensor.anomaly.engine.statistical.StatisticalDetector;
import com.sensor.anomaly.engine.threshold.ThresholdDetector;
import com.sensor.anomaly.exception.InvalidRecordException;
import com.sensor.anomaly.model.AlarmResult;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.DetectionResponse;
import com.sensor.anomaly.model.DetectionStatus;
import com.sensor.anomaly.model.ModelDetectionResponse;
import com.sensor.anomaly.model.ModelResult;
import com.sensor.anomaly.model.PipelineResponse;
import com.sensor.anomaly.model.SensorRecord;
import com.sensor.anomaly.repository.SlidingWindowStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Main orchestrator for sensor record evaluation.
 *
 * Flow of {@link #detect(SensorRecord)}:
 * 1. Threshold rules. Any anomaly stops the run here.
 * 2. Statistical outlier detection (reads, then appends to, each sensor window)
 * 3. Reconstruction model over the full feature vector
 *
 * Each stage is also exposed on its own, bypassing the short-circuit, for direct or
 * diagnostic use. Every call is timed and the elapsed time is part of the response.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final ThresholdDetector thresholdDetector;
    private final StatisticalDetector statisticalDetector;
    private final ReconstructionModelDetector modelDetector;
    private final SlidingWindowStore windowStore;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public AnomalyDetectionService(ThresholdDetector thresholdDetector,
                                   StatisticalDetector statisticalDetector,
                                   ReconstructionModelDetector modelDetector,
                                   SlidingWindowStore windowStore,
                                   MetricsConfig metricsConfig,
                                   Tracer tracer) {
        this.thresholdDetector = thresholdDetector;
        this.statisticalDetector = statisticalDetector;
        this.modelDetector = modelDetector;
        this.windowStore = windowStore;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @Observed(name = "detection.threshold", contextualName = "detect-threshold")
    public DetectionResponse detectThreshold(SensorRecord record) {
        validate(record);
        return runStage(thresholdDetector, record);
    }

    @Observed(name = "detection.statistical", contextualName = "detect-statistical")
    public DetectionResponse detectStatistical(SensorRecord record) {
        validate(record);
        return runStage(statisticalDetector, record);
    }

    @Observed(name = "detection.model", contextualName = "detect-model")
    public ModelDetectionResponse detectModel(SensorRecord record) {
        validate(record);
        return runModel(record);
    }

    /**
     * Run the full pipeline with threshold short-circuit.
     */
    @Observed(name = "detection.pipeline", contextualName = "detect-pipeline")
    public PipelineResponse detect(SensorRecord record) {
        validate(record);
        long start = System.nanoTime();

        DetectionResponse threshold = traced(DetectionMethod.HEURISTIC, () -> runStage(thresholdDetector, record));
        if (threshold.hasAnomaly()) {
            metricsConfig.recordShortCircuit();
            log.warn("Threshold anomaly at {}: {}. Skipping statistical and model stages.",
                    record.getTimestamp(), anomalies(threshold));
            return finish(PipelineResponse.builder()
                    .timestamp(record.getTimestamp())
                    .finalStage(DetectionMethod.HEURISTIC)
                    .status(DetectionStatus.ANOMALY)
                    .threshold(threshold), start);
        }

        DetectionResponse statistical = traced(DetectionMethod.STATISTICAL, () -> runStage(statisticalDetector, record));
        ModelDetectionResponse model = traced(DetectionMethod.ML, () -> runModel(record));

        DetectionStatus status;
        if (statistical.hasAnomaly() || model.getResult().isAnomaly()) {
            status = DetectionStatus.ANOMALY;
            log.warn("Anomaly at {}: statistical={}, model={}",
                    record.getTimestamp(), anomalies(statistical), model.getResult().getStatus().getLabel());
        } else if (model.getResult().getStatus() == DetectionStatus.ERROR) {
            status = DetectionStatus.ERROR;
        } else {
            status = DetectionStatus.NORMAL;
        }

        return finish(PipelineResponse.builder()
                .timestamp(record.getTimestamp())
                .finalStage(DetectionMethod.ML)
                .status(status)
                .threshold(threshold)
                .statistical(statistical)
                .model(model), start);
    }

    /**
     * Window lengths per sensor and reconstruction model metadata.
     */
    public Map<String, Object> systemHealth() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("windowSizes", windowStore.windowSizes("*"));
        health.put("windowCapacity", windowStore.capacity());
        health.put("model", modelDetector.describe());
        return health;
    }

    private DetectionResponse runStage(SensorDetector detector, SensorRecord record) {
        long start = System.nanoTime();
        Map<String, AlarmResult> results = detector.evaluate(record);
        long elapsed = System.nanoTime() - start;

        DetectionResponse response = DetectionResponse.builder()
                .timestamp(record.getTimestamp())
                .method(detector.getMethod())
                .results(results)
                .processingTimeMs(toMillis(elapsed))
                .build();

        metricsConfig.recordDetection(detector.getMethod().getTag(),
                (response.hasAnomaly() ? DetectionStatus.ANOMALY : DetectionStatus.NORMAL).getLabel(), elapsed);
        log.debug("{} detection completed in {} ms", detector.getMethod().getTag(), response.getProcessingTimeMs());
        return response;
    }

    private ModelDetectionResponse runModel(SensorRecord record) {
        long start = System.nanoTime();
        ModelResult result = modelDetector.evaluate(record);
        long elapsed = System.nanoTime() - start;

        metricsConfig.recordDetection(DetectionMethod.ML.getTag(), result.getStatus().getLabel(), elapsed);
        return ModelDetectionResponse.builder()
                .timestamp(record.getTimestamp())
                .result(result)
                .processingTimeMs(toMillis(elapsed))
                .build();
    }

    private <T> T traced(DetectionMethod stage, Supplier<T> action) {
        Span span = tracer.nextSpan()
                .name("detection.stage." + stage.getTag())
                .tag("stage", stage.getTag())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return action.get();
        } catch (RuntimeException e) {
            span.error(e);
            log.error("{} stage failed: {}", stage.getTag(), e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    private PipelineResponse finish(PipelineResponse.PipelineResponseBuilder builder, long start) {
        long elapsed = System.nanoTime() - start;
        PipelineResponse response = builder.processingTimeMs(toMillis(elapsed)).build();
        metricsConfig.recordDetection(DetectionMethod.PIPELINE.getTag(), response.getStatus().getLabel(), elapsed);
        return response;
    }

    private static void validate(SensorRecord record) {
        if (record == null) {
            throw new InvalidRecordException("Record is required");
        }
        if (record.getTimestamp() == null) {
            throw new InvalidRecordException("Record timestamp is required");
        }
        if (record.getData() == null || record.getData().isEmpty()) {
            throw new InvalidRecordException("Record data must contain at least one variable");
        }
        record.getData().forEach((variable, value) -> {
            if (variable == null || value == null || value.isNaN()) {
                throw new InvalidRecordException("Invalid value for variable " + variable + ": " + value);
            }
        });
    }

    private static Map<String, String> anomalies(DetectionResponse response) {
        Map<String, String> anomalies = new LinkedHashMap<>();
        response.getResults().forEach((variable, result) -> {
            if (result.isAnomaly()) {
                anomalies.put(variable, result.getAlarmType().getLabel());
            }
        });
        return anomalies;
    }

    private static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
