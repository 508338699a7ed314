package com.sensor.anomaly.engine.threshold;

import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.enrichment.ContextEnricher;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import com.sensor.anomaly.model.AlarmResult;
import com.sensor.anomaly.model.AlarmType;
import com.sensor.anomaly.model.DetectionStatus;
import com.sensor.anomaly.model.ThresholdLimits;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ThresholdDetectorTest {

    @Mock private ContextEnricher contextEnricher;
    @Mock private MetricsConfig metricsConfig;

    private ThresholdDetector detector;

    @BeforeEach
    void setUp() {
        ThresholdSet thresholds = new ThresholdSet(Map.of(
                "P1", TestDataFactory.createLimits(0, 10, 90, 100)));
        detector = new ThresholdDetector(thresholds, contextEnricher, metricsConfig);
    }

    @ParameterizedTest
    @CsvSource({
            "-0.1, LOW_LOW",
            "0,    LOW",
            "9.99, LOW",
            "10,   OK",
            "50,   OK",
            "90,   OK",
            "90.1, HIGH",
            "100,  HIGH",
            "100.1, HIGH_HIGH"
    })
    void classify_boundaries_lowAndHighAreInclusiveOk(double value, AlarmType expected) {
        ThresholdLimits limits = TestDataFactory.createLimits(0, 10, 90, 100);

        assertThat(ThresholdDetector.classify(value, limits)).isEqualTo(expected);
    }

    @Test
    void evaluate_mixedRecord_classifiesEachVariable() {
        when(contextEnricher.enrich("P1", AlarmType.LOW)).thenReturn("Cause: clog. Actions: flush");

        AlarmResult low = detector.evaluate(TestDataFactory.createRecord("P1", 5)).get("P1");
        AlarmResult ok = detector.evaluate(TestDataFactory.createRecord("P1", 50)).get("P1");

        assertThat(low.getAlarmType()).isEqualTo(AlarmType.LOW);
        assertThat(low.getStatus()).isEqualTo(DetectionStatus.ANOMALY);
        assertThat(low.getContext()).isEqualTo("Cause: clog. Actions: flush");
        assertThat(ok.getAlarmType()).isEqualTo(AlarmType.OK);
        assertThat(ok.getStatus()).isEqualTo(DetectionStatus.NORMAL);
        assertThat(ok.getContext()).isEmpty();
    }

    @Test
    void evaluate_aboveHighHigh_reportsHighHighAndRecordsAlarm() {
        when(contextEnricher.enrich(anyString(), any())).thenReturn("");

        Map<String, AlarmResult> results = detector.evaluate(TestDataFactory.createRecord("P1", 150));

        assertThat(results.get("P1").getAlarmType()).isEqualTo(AlarmType.HIGH_HIGH);
        assertThat(results.get("P1").getValue()).isEqualTo(150.0);
        verify(metricsConfig).recordAlarm("heuristic", "High-High");
    }

    @Test
    void evaluate_unknownVariable_isNormalWithoutEnrichment() {
        Map<String, AlarmResult> results = detector.evaluate(TestDataFactory.createRecord("UNKNOWN", 1e9));

        assertThat(results.get("UNKNOWN").getAlarmType()).isEqualTo(AlarmType.OK);
        assertThat(results.get("UNKNOWN").getStatus()).isEqualTo(DetectionStatus.NORMAL);
        verify(contextEnricher, never()).enrich(anyString(), any());
    }

    @Test
    void evaluate_okValue_neverCallsEnricher() {
        detector.evaluate(TestDataFactory.createRecord("P1", 10, "UNKNOWN", 3));

        verify(contextEnricher, never()).enrich(anyString(), any());
        verify(metricsConfig, never()).recordAlarm(anyString(), anyString());
    }

    @Test
    void evaluate_returnsEntryForEveryInputVariable() {
        Map<String, AlarmResult> results = detector.evaluate(
                TestDataFactory.createRecord("P1", 50, "A", 1, "B", 2));

        assertThat(results).containsOnlyKeys("P1", "A", "B");
    }

    @Test
    void constructor_emptyThresholds_throws() {
        assertThatThrownBy(() -> new ThresholdDetector(new ThresholdSet(Map.of()), contextEnricher, metricsConfig))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("thresholds");
    }

    @Test
    void constructor_incompleteLimits_throws() {
        ThresholdLimits partial = ThresholdLimits.builder().lowLow(0.0).low(10.0).high(90.0).build();

        assertThatThrownBy(() -> new ThresholdDetector(new ThresholdSet(Map.of("P1", partial)),
                contextEnricher, metricsConfig))
                .isInstanceOf(DetectorConfigurationException.class)
                .hasMessageContaining("P1");
    }

    @Test
    void constructor_unorderedLimits_stillLoads() {
        ThresholdSet thresholds = new ThresholdSet(Map.of(
                "P2", TestDataFactory.createLimits(50, 10, 90, 100)));

        ThresholdDetector unordered = new ThresholdDetector(thresholds, contextEnricher, metricsConfig);

        assertThat(unordered.evaluate(TestDataFactory.createRecord("P2", 20)).get("P2").getAlarmType())
                .isEqualTo(AlarmType.LOW_LOW);
    }
}
