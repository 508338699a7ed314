package com.sensor.anomaly.engine.reconstruction;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.model.DetectionStatus;
import com.sensor.anomaly.model.ModelResult;
import com.sensor.anomaly.model.SensorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a whole record by PCA reconstruction error. The verdict is aggregate, not
 * per-variable: Anomaly when the error exceeds the trained threshold, Normal otherwise,
 * and Error when a required feature is missing (malformed input, not an anomalous reading).
 */
@Component
public class ReconstructionModelDetector {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionModelDetector.class);

    private final ReconstructionModel model;
    private final MetricsConfig metricsConfig;

    public ReconstructionModelDetector(ReconstructionModel model, MetricsConfig metricsConfig) {
        this.model = model;
        this.metricsConfig = metricsConfig;
    }

    public ModelResult evaluate(SensorRecord record) {
        Map<String, Double> data = record.getData() != null ? record.getData() : Map.of();
        List<String> featureNames = model.getFeatureNames();

        List<String> missing = new ArrayList<>();
        double[] features = new double[featureNames.size()];
        for (int i = 0; i < featureNames.size(); i++) {
            Double value = data.get(featureNames.get(i));
            if (value == null) {
                missing.add(featureNames.get(i));
            } else {
                features[i] = value;
            }
        }

        if (!missing.isEmpty()) {
            log.warn("Record at {} is missing required features {}", record.getTimestamp(), missing);
            return error(data, missing);
        }

        double reconstructionError;
        try {
            reconstructionError = model.reconstructionError(features);
        } catch (RuntimeException e) {
            log.error("Reconstruction scoring failed for record at {}: {}", record.getTimestamp(), e.getMessage(), e);
            return error(data, List.of());
        }
        if (Double.isNaN(reconstructionError)) {
            log.warn("Reconstruction error is NaN for record at {}", record.getTimestamp());
            return error(data, List.of());
        }

        boolean anomalous = model.isAnomalous(reconstructionError);
        if (anomalous) {
            metricsConfig.recordAlarm("ml", DetectionStatus.ANOMALY.getLabel());
            log.debug("Reconstruction error {} exceeds threshold {}", reconstructionError, model.getThreshold());
        }

        return ModelResult.builder()
                .values(new LinkedHashMap<>(data))
                .status(anomalous ? DetectionStatus.ANOMALY : DetectionStatus.NORMAL)
                .reconstructionError(reconstructionError)
                .threshold(model.getThreshold())
                .build();
    }

    /**
     * Model metadata for health and statistics reporting.
     */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("modelPath", model.getSource());
        info.put("threshold", model.getThreshold());
        info.put("pcaComponents", model.getComponentCount());
        info.put("features", model.getFeatureNames());
        info.put("modelsLoaded", true);
        return info;
    }

    private ModelResult error(Map<String, Double> data, List<String> missing) {
        return ModelResult.builder()
                .values(new LinkedHashMap<>(data))
                .status(DetectionStatus.ERROR)
                .threshold(model.getThreshold())
                .missingFeatures(missing)
                .build();
    }
}
