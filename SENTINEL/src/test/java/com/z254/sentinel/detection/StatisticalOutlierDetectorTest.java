package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.z254.sentinel.TestSamples.START;
import static com.z254.sentinel.TestSamples.constant;
import static com.z254.sentinel.TestSamples.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalOutlierDetector}.
 */
class StatisticalOutlierDetectorTest {

    private static final Instant RECENT_START = START.plus(Duration.ofHours(20));

    private StatisticalOutlierDetector detector;

    @BeforeEach
    void setUp() {
        detector = new StatisticalOutlierDetector(new SentinelProperties(), new AnomalyNarrator());
    }

    @Nested
    @DisplayName("Three sigma threshold")
    class ThresholdTests {

        @Test
        @DisplayName("should flag 3.1 sigma and ignore 2.9 sigma")
        void flagsOnlyBeyondThreeSigma() {
            List<AnomalyDetection> anomalies = detector.detect(windows(
                    withTail(constant(RECENT_START, 10, 100), 131, 129)));

            assertThat(anomalies).hasSize(1);
            AnomalyDetection anomaly = anomalies.get(0);
            assertThat(anomaly.getActualValue()).isEqualTo(131);
            assertThat(anomaly.getExpectedValue()).isEqualTo(100);
            assertThat(anomaly.getDeviation()).isCloseTo(3.1, within(1e-9));
            assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(anomaly.getConfidence()).isCloseTo(0.775, within(1e-9));
            assertThat(anomaly.getDetectedAt()).isEqualTo(RECENT_START.plus(Duration.ofHours(10)));
        }

        @Test
        @DisplayName("should report nothing when the baseline is constant")
        void constantBaselineYieldsNoSignal() {
            MetricWindows windows = new MetricWindows("cpu",
                    new TimeRange(RECENT_START, RECENT_START.plus(Duration.ofHours(12))),
                    new TimeRange(START, RECENT_START),
                    withTail(constant(RECENT_START, 10, 100), 500),
                    constant(START, 20, 100));

            assertThat(detector.detect(windows)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Subtype classification")
    class ClassificationTests {

        @Test
        @DisplayName("should classify as spike even when the local trend qualifies")
        void spikeTakesPriorityOverTrendChange() {
            List<AnomalyDetection> anomalies = detector.detect(windows(
                    withTail(constant(RECENT_START, 10, 100), 250)));

            assertThat(anomalies).singleElement()
                    .satisfies(anomaly -> {
                        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.SPIKE);
                        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
                        assertThat(anomaly.getConfidence()).isEqualTo(1.0);
                        assertThat(anomaly.getDescription())
                                .isEqualTo("cpu experienced a 150% increase above normal levels");
                        assertThat(anomaly.getRecommendations()).containsExactly(
                                "Investigate immediately and implement corrective measures",
                                "Check for increased demand or system issues",
                                "Consider scaling resources if trend continues");
                    });
        }

        @Test
        @DisplayName("should classify values below half the mean as drop")
        void dropBelowHalfTheMean() {
            List<AnomalyDetection> anomalies = detector.detect(windows(
                    withTail(constant(RECENT_START, 10, 100), 40)));

            assertThat(anomalies).singleElement()
                    .satisfies(anomaly -> {
                        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.DROP);
                        assertThat(anomaly.getDescription()).isEqualTo("cpu dropped 60% below normal levels");
                    });
        }

        @Test
        @DisplayName("should classify a steep local rise as trend change")
        void steepLocalRiseIsTrendChange() {
            List<AnomalyDetection> anomalies = detector.detect(windows(
                    withTail(constant(RECENT_START, 10, 100), 100, 140)));

            assertThat(anomalies).singleElement()
                    .extracting(AnomalyDetection::getAnomalyType)
                    .isEqualTo(AnomalyType.TREND_CHANGE);
        }

        @Test
        @DisplayName("should only consider the local trend once three samples precede the outlier")
        void localTrendNeedsThreePrecedingSamples() {
            List<AnomalyDetection> atIndexTwo = detector.detect(windows(hourly(RECENT_START, 100, 100, 140)));
            List<AnomalyDetection> atIndexThree = detector.detect(windows(hourly(RECENT_START, 100, 100, 100, 140)));

            assertThat(atIndexTwo).singleElement()
                    .extracting(AnomalyDetection::getAnomalyType)
                    .isEqualTo(AnomalyType.OUTLIER);
            assertThat(atIndexThree).singleElement()
                    .extracting(AnomalyDetection::getAnomalyType)
                    .isEqualTo(AnomalyType.TREND_CHANGE);
        }

        @Test
        @DisplayName("should fall back to outlier when the local trend is flat")
        void flatLocalTrendIsOutlier() {
            List<AnomalyDetection> anomalies = detector.detect(windows(
                    withTail(constant(RECENT_START, 8, 100), 128, 130, 135)));

            assertThat(anomalies).singleElement()
                    .satisfies(anomaly -> {
                        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.OUTLIER);
                        assertThat(anomaly.getActualValue()).isEqualTo(135);
                        assertThat(anomaly.getDescription())
                                .isEqualTo("cpu deviated significantly from expected pattern");
                    });
        }
    }

    @Test
    void severityBands() {
        assertThat(StatisticalOutlierDetector.severityFor(4.5)).isEqualTo(Severity.CRITICAL);
        assertThat(StatisticalOutlierDetector.severityFor(3.5)).isEqualTo(Severity.HIGH);
        assertThat(StatisticalOutlierDetector.severityFor(2.7)).isEqualTo(Severity.MEDIUM);
        assertThat(StatisticalOutlierDetector.severityFor(2.0)).isEqualTo(Severity.LOW);
    }

    /**
     * Windows against a baseline of alternating 90 and 110: mean 100, standard deviation 10.
     */
    private MetricWindows windows(List<MetricSample> recent) {
        double[] baseline = new double[20];
        for (int i = 0; i < baseline.length; i++) {
            baseline[i] = i % 2 == 0 ? 90 : 110;
        }
        return new MetricWindows("cpu",
                new TimeRange(RECENT_START, RECENT_START.plus(Duration.ofHours(20))),
                new TimeRange(START, RECENT_START),
                recent,
                hourly(START, baseline));
    }

    private List<MetricSample> withTail(List<MetricSample> head, double... tail) {
        List<MetricSample> samples = new ArrayList<>(head);
        Instant next = head.get(head.size() - 1).timestamp();
        for (double value : tail) {
            next = next.plus(Duration.ofHours(1));
            samples.add(new MetricSample(next, value));
        }
        return samples;
    }
}
