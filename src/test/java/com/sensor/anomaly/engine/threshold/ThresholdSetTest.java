package com.sensor.anomaly.engine.threshold;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdSetTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void read_validFile_parsesAllLevels() {
        ThresholdSet set = ThresholdSet.read(json(
                "{\"P1\": {\"Low-Low\": 0, \"Low\": 10, \"High\": 90, \"High-High\": 100},"
                        + " \"T1\": {\"Low-Low\": -5.5, \"Low\": 0, \"High\": 40, \"High-High\": 55}}"),
                objectMapper, "test");

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.variables()).containsExactly("P1", "T1");
        assertThat(set.get("P1").getLow()).isEqualTo(10.0);
        assertThat(set.get("T1").getLowLow()).isEqualTo(-5.5);
        assertThat(set.get("T1").getHighHigh()).isEqualTo(55.0);
        assertThat(set.contains("X")).isFalse();
    }

    @Test
    void read_emptyObject_throws() {
        assertThatThrownBy(() -> ThresholdSet.read(json("{}"), objectMapper, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("thresholds.json");
    }

    @Test
    void read_malformedJson_throws() {
        assertThatThrownBy(() -> ThresholdSet.read(json("{\"P1\": "), objectMapper, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class);
    }

    @Test
    void read_nullLimits_throws() {
        assertThatThrownBy(() -> ThresholdSet.read(json("{\"P1\": null}"), objectMapper, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("P1");
    }

    @Test
    void read_missingLevel_throws() {
        assertThatThrownBy(() -> ThresholdSet.read(
                json("{\"P1\": {\"Low-Low\": 0, \"Low\": 10, \"High\": 90}}"), objectMapper, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("P1")
                .hasMessageContaining("High-High");
    }

    @Test
    void read_misspelledLevel_throws() {
        ObjectMapper lenient = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        assertThatThrownBy(() -> ThresholdSet.read(
                json("{\"P1\": {\"LowLow\": 0, \"Low\": 10, \"High\": 90, \"High-High\": 100}}"),
                lenient, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("P1");
    }

    @Test
    void read_nullLevel_throws() {
        assertThatThrownBy(() -> ThresholdSet.read(
                json("{\"P1\": {\"Low-Low\": 0, \"Low\": null, \"High\": 90, \"High-High\": 100}}"),
                objectMapper, "thresholds.json"))
                .isInstanceOf(DetectorConfigurationException.class);
    }

    @Test
    void read_bundledThresholds_loadsAndIsOrdered() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/data/thresholds.json")) {
            ThresholdSet set = ThresholdSet.read(in, objectMapper, "data/thresholds.json");

            assertThat(set.isEmpty()).isFalse();
            set.variables().forEach(variable -> {
                assertThat(set.get(variable).isComplete()).isTrue();
                assertThat(set.get(variable).isOrdered()).isTrue();
            });
        }
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
