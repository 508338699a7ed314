package com.sensor.anomaly.engine.reconstruction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;

/**
 * Loads the four model artifacts from a directory:
 * <ul>
 *   <li>{@code scaler.json}: {@code {"mean": [..], "scale": [..]}}</li>
 *   <li>{@code pca.json}: {@code {"components": [[..], ..], "mean": [..]}}</li>
 *   <li>{@code threshold.json}: a number or {@code {"threshold": n}}</li>
 *   <li>{@code features.json}: ordered feature names</li>
 * </ul>
 * Any missing file or shape mismatch fails the whole load.
 */
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    public static final String SCALER_FILE = "scaler.json";
    public static final String PCA_FILE = "pca.json";
    public static final String THRESHOLD_FILE = "threshold.json";
    public static final String FEATURES_FILE = "features.json";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public ModelArtifactLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public ReconstructionModel load(String location) {
        String base = location.endsWith("/") ? location : location + "/";

        List<String> features = read(base, FEATURES_FILE, in ->
                objectMapper.readValue(in, new TypeReference<List<String>>() {}));
        JsonNode scaler = read(base, SCALER_FILE, objectMapper::readTree);
        JsonNode pca = read(base, PCA_FILE, objectMapper::readTree);
        JsonNode thresholdNode = read(base, THRESHOLD_FILE, objectMapper::readTree);

        if (features == null || features.isEmpty()) {
            throw new DetectorConfigurationException(base + FEATURES_FILE, "feature list is empty");
        }
        if (new HashSet<>(features).size() != features.size()) {
            throw new DetectorConfigurationException(base + FEATURES_FILE, "feature names must be unique");
        }
        int n = features.size();

        double[] scalerMean = vector(scaler.path("mean"), n, base + SCALER_FILE, "mean");
        double[] scalerScale = vector(scaler.path("scale"), n, base + SCALER_FILE, "scale");
        for (int i = 0; i < n; i++) {
            // Constant features were fitted with scale 0; the scaler leaves them unscaled
            if (scalerScale[i] == 0.0) {
                scalerScale[i] = 1.0;
            }
        }

        double[] pcaMean = vector(pca.path("mean"), n, base + PCA_FILE, "mean");
        JsonNode rows = pca.path("components");
        if (!rows.isArray() || rows.isEmpty() || rows.size() > n) {
            throw new DetectorConfigurationException(base + PCA_FILE,
                    "components must hold between 1 and " + n + " rows");
        }
        double[][] components = new double[rows.size()][];
        for (int k = 0; k < rows.size(); k++) {
            components[k] = vector(rows.get(k), n, base + PCA_FILE, "components[" + k + "]");
        }

        JsonNode thresholdValue = thresholdNode.isNumber() ? thresholdNode : thresholdNode.path("threshold");
        if (!thresholdValue.isNumber()) {
            throw new DetectorConfigurationException(base + THRESHOLD_FILE, "threshold must be numeric");
        }

        ReconstructionModel model = new ReconstructionModel(features, scalerMean, scalerScale,
                components, pcaMean, thresholdValue.asDouble(), location);
        log.info("Reconstruction model loaded from {}: {} features, {} components, threshold={}",
                location, n, components.length, model.getThreshold());
        return model;
    }

    private <T> T read(String base, String file, ArtifactReader<T> reader) {
        String location = base + file;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DetectorConfigurationException(location, "model artifact not found");
        }
        try (InputStream in = resource.getInputStream()) {
            return reader.read(in);
        } catch (IOException e) {
            throw new DetectorConfigurationException(location, "unreadable model artifact", e);
        }
    }

    private static double[] vector(JsonNode node, int expected, String source, String field) {
        if (!node.isArray() || node.size() != expected) {
            throw new DetectorConfigurationException(source,
                    String.format("%s must be an array of %d numbers", field, expected));
        }
        double[] values = new double[expected];
        for (int i = 0; i < expected; i++) {
            JsonNode element = node.get(i);
            if (!element.isNumber()) {
                throw new DetectorConfigurationException(source, field + "[" + i + "] is not numeric");
            }
            values[i] = element.asDouble();
        }
        return values;
    }

    @FunctionalInterface
    private interface ArtifactReader<T> {
        T read(InputStream in) throws IOException;
    }
}
