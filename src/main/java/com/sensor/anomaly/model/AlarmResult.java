package com.sensor.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlarmResult {

    private double value;

    private AlarmType alarmType;

    private DetectionStatus status;

    // Empty when the alarm is OK or the corpus has nothing for this variable/alarm
    @Builder.Default
    private String context = "";

    public static AlarmResult of(double value, AlarmType alarmType) {
        return AlarmResult.builder()
                .value(value)
                .alarmType(alarmType)
                .status(alarmType.toStatus())
                .build();
    }

    public boolean isAnomaly() {
        return status == DetectionStatus.ANOMALY;
    }
}
