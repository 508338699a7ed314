package com.sensor.anomaly.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import com.sensor.anomaly.model.ContextEntry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlarmContextCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void read_cleansWhitespace() {
        AlarmContextCatalog catalog = AlarmContextCatalog.read(json(
                "{\"P1\": {\"High\": {\"Cause\": \"  Valve\\n   stuck \", \"Actions\": \"Check\\t\\tvalve\"}}}"),
                objectMapper, "test");

        ContextEntry entry = catalog.lookup("P1", "High").orElseThrow();
        assertThat(entry.getCause()).isEqualTo("Valve stuck");
        assertThat(entry.getActions()).isEqualTo("Check valve");
    }

    @Test
    void lookup_missingVariableOrAlarm_isEmpty() {
        AlarmContextCatalog catalog = AlarmContextCatalog.read(json(
                "{\"P1\": {\"High\": {\"Cause\": \"c\", \"Actions\": \"a\"}}}"), objectMapper, "test");

        assertThat(catalog.lookup("P1", "Low")).isEmpty();
        assertThat(catalog.lookup("P2", "High")).isEmpty();
        assertThat(catalog.size()).isEqualTo(1);
    }

    @Test
    void read_missingFields_defaultToEmpty() {
        AlarmContextCatalog catalog = AlarmContextCatalog.read(json(
                "{\"P1\": {\"Low\": {\"Cause\": \"c\"}}}"), objectMapper, "test");

        assertThat(catalog.lookup("P1", "Low").orElseThrow().getActions()).isEmpty();
    }

    @Test
    void read_notAnObject_throws() {
        assertThatThrownBy(() -> AlarmContextCatalog.read(json("[1, 2]"), objectMapper, "ctx.json"))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("ctx.json");
    }

    @Test
    void read_bundledCorpus_loads() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/data/alarm_context.json")) {
            AlarmContextCatalog catalog = AlarmContextCatalog.read(in, objectMapper, "data/alarm_context.json");

            assertThat(catalog.lookup("INJECTION_PRESSURE", "High-High")).isPresent();
        }
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
