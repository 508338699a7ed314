package com.sensor.anomaly.engine.reconstruction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelArtifactLoaderTest {

    private final ModelArtifactLoader loader =
            new ModelArtifactLoader(new DefaultResourceLoader(), new ObjectMapper());

    @TempDir
    Path modelDir;

    @Test
    void load_validArtifacts_buildsModel() {
        ReconstructionModel model = loader.load("classpath:fixtures/model");

        assertThat(model.getFeatureNames()).containsExactly("a", "b", "c");
        assertThat(model.getThreshold()).isEqualTo(0.5);
        assertThat(model.getComponentCount()).isEqualTo(1);
        assertThat(model.getSource()).isEqualTo("classpath:fixtures/model");
    }

    @Test
    void load_bundledModel_loads() {
        ReconstructionModel model = loader.load("classpath:data/model/");

        assertThat(model.getFeatureNames()).contains("WATER_FLOW_RATE", "INJECTION_PRESSURE");
        assertThat(model.getThreshold()).isPositive();
    }

    @Test
    void load_vectorLengthMismatch_throws() {
        assertThatThrownBy(() -> loader.load("classpath:fixtures/model-bad-shape"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("scaler.json");
    }

    @Test
    void load_missingDirectory_throws() {
        assertThatThrownBy(() -> loader.load("classpath:fixtures/no-such-model"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_zeroScale_treatedAsUnscaled() throws IOException {
        write("features.json", "[\"a\", \"b\"]");
        write("scaler.json", "{\"mean\": [1, 1], \"scale\": [0, 1]}");
        write("pca.json", "{\"components\": [[0, 1]], \"mean\": [0, 0]}");
        write("threshold.json", "1.0");

        ReconstructionModel model = loader.load(modelDir.toUri().toString());

        // a is centred but not divided: (3 - 1) = 2, not reconstructed, error = 2^2 / 2
        assertThat(model.reconstructionError(new double[] {3, 1})).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void load_nonNumericThreshold_throws() throws IOException {
        write("features.json", "[\"a\"]");
        write("scaler.json", "{\"mean\": [0], \"scale\": [1]}");
        write("pca.json", "{\"components\": [[1]], \"mean\": [0]}");
        write("threshold.json", "{\"threshold\": \"high\"}");

        assertThatThrownBy(() -> loader.load(modelDir.toUri().toString()))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("threshold");
    }

    @Test
    void load_duplicateFeatureNames_throws() throws IOException {
        write("features.json", "[\"a\", \"a\"]");
        write("scaler.json", "{\"mean\": [0, 0], \"scale\": [1, 1]}");
        write("pca.json", "{\"components\": [[1, 0]], \"mean\": [0, 0]}");
        write("threshold.json", "1.0");

        assertThatThrownBy(() -> loader.load(modelDir.toUri().toString()))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("unique");
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(modelDir.resolve(name), content);
    }
}
