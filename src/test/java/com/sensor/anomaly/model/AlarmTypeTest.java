package com.sensor.anomaly.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlarmTypeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesAsLabel() throws Exception {
        assertThat(objectMapper.writeValueAsString(AlarmType.HIGH_HIGH)).isEqualTo("\"High-High\"");
        assertThat(objectMapper.writeValueAsString(DetectionStatus.ANOMALY)).isEqualTo("\"Anomaly\"");
    }

    @Test
    void fromLabel_acceptsLabelOrName() {
        assertThat(AlarmType.fromLabel("Low-Low")).isEqualTo(AlarmType.LOW_LOW);
        assertThat(AlarmType.fromLabel("high_high")).isEqualTo(AlarmType.HIGH_HIGH);
        assertThat(AlarmType.fromLabel("ok")).isEqualTo(AlarmType.OK);
    }

    @Test
    void fromLabel_unknown_throws() {
        assertThatThrownBy(() -> AlarmType.fromLabel("Critical")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyOkMapsToNormal() {
        for (AlarmType type : AlarmType.values()) {
            assertThat(type.toStatus())
                    .isEqualTo(type == AlarmType.OK ? DetectionStatus.NORMAL : DetectionStatus.ANOMALY);
        }
    }
}
