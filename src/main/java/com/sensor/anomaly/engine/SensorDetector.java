package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.AlarmResult;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.SensorRecord;

import java.util.Map;

/**
 * A detection stage that classifies each variable of a record independently.
 */
public interface SensorDetector {

    DetectionMethod getMethod();

    /**
     * Classify every variable in the record.
     *
     * @param record the incoming reading
     * @return one result per variable, in the record's iteration order
     */
    Map<String, AlarmResult> evaluate(SensorRecord record);
}
