package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.z254.sentinel.TestSamples.START;
import static com.z254.sentinel.TestSamples.constant;
import static com.z254.sentinel.TestSamples.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeasonalPatternDetectorTest {

    private static final Instant RECENT_START = START.plus(Duration.ofDays(1));

    private SeasonalPatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SeasonalPatternDetector(new SentinelProperties());
    }

    @Test
    void reportsBucketWhoseIndexShifted() {
        List<AnomalyDetection> anomalies = detector.detect(windows(recentWithPeakAtHour(5, 400)));

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.SEASONAL_DEVIATION);
            assertThat(anomaly.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(anomaly.getConfidence()).isEqualTo(0.7);
            assertThat(anomaly.getExpectedValue()).isCloseTo(100.0, within(1e-9));
            assertThat(anomaly.getActualValue()).isEqualTo(400.0);
            assertThat(anomaly.getDeviation()).isCloseTo(3.0, within(1e-9));
            assertThat(anomaly.getDetectedAt()).isEqualTo(RECENT_START.plus(Duration.ofHours(5)));
            assertThat(anomaly.getRecommendations()).containsExactly(
                    "Investigate seasonal pattern changes", "Update baseline patterns");
        });
    }

    @Test
    void unchangedPatternYieldsNothing() {
        assertThat(detector.detect(windows(constant(RECENT_START, 24, 130)))).isEmpty();
    }

    @Test
    void zeroMeanBaselineYieldsNoSignal() {
        MetricWindows windows = new MetricWindows("api_calls",
                new TimeRange(RECENT_START, RECENT_START.plus(Duration.ofDays(1))),
                new TimeRange(START, RECENT_START),
                recentWithPeakAtHour(5, 400),
                constant(START, 24, 0.0));

        assertThat(detector.detect(windows)).isEmpty();
    }

    private MetricWindows windows(List<MetricSample> recent) {
        return new MetricWindows("api_calls",
                new TimeRange(RECENT_START, RECENT_START.plus(Duration.ofDays(1))),
                new TimeRange(START, RECENT_START),
                recent,
                constant(START, 24, 100));
    }

    private List<MetricSample> recentWithPeakAtHour(int hour, double peak) {
        double[] values = new double[24];
        for (int i = 0; i < values.length; i++) {
            values[i] = i == hour ? peak : 100;
        }
        return hourly(RECENT_START, values);
    }
}
