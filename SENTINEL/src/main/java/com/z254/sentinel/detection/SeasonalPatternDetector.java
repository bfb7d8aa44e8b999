package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares per-bucket seasonal indices of the recent window with those of the baseline.
 * <p>
 * A bucket whose index moved by more than the configured threshold is reported against the
 * most recent sample falling in the same hour of the cycle (UTC). Buckets with no such sample
 * carry no observation and are skipped.
 */
@Slf4j
@Component
public class SeasonalPatternDetector implements AnomalyDetector {

    static final double CONFIDENCE = 0.7;

    private final SentinelProperties sentinelProperties;

    public SeasonalPatternDetector(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public String name() {
        return "seasonal";
    }

    @Override
    public List<AnomalyDetection> detect(MetricWindows windows) {
        SentinelProperties.Detection config = sentinelProperties.getDetection();
        int period = config.getSeasonalPeriod();

        double[] baselineIndices = SeriesStatistics.seasonalIndices(windows.baseline(), period);
        double[] recentIndices = SeriesStatistics.seasonalIndices(windows.recent(), period);
        if (baselineIndices == null || recentIndices == null) {
            log.debug("No seasonal signal for {}: zero mean or empty window", windows.metric());
            return List.of();
        }

        double baselineMean = SeriesStatistics.mean(windows.baseline());
        List<AnomalyDetection> anomalies = new ArrayList<>();

        for (int bucket = 0; bucket < period; bucket++) {
            double indexShift = Math.abs(recentIndices[bucket] - baselineIndices[bucket]);
            if (indexShift <= config.getSeasonalDeviationThreshold()) {
                continue;
            }

            Optional<MetricSample> observed = latestInBucket(windows.recent(), bucket, period);
            if (observed.isEmpty()) {
                continue;
            }

            double expected = baselineMean * baselineIndices[bucket];
            double actual = observed.get().value();
            double deviation = expected != 0.0
                    ? Math.abs(actual - expected) / Math.abs(expected)
                    : indexShift;

            anomalies.add(AnomalyDetection.builder()
                    .id(UUID.randomUUID().toString())
                    .metric(windows.metric())
                    .detectedAt(observed.get().timestamp())
                    .anomalyType(AnomalyType.SEASONAL_DEVIATION)
                    .severity(Severity.MEDIUM)
                    .description(String.format("Seasonal pattern deviation detected for %s at hour %d",
                            windows.metric(), bucket))
                    .expectedValue(expected)
                    .actualValue(actual)
                    .deviation(deviation)
                    .confidence(CONFIDENCE)
                    .recommendations(List.of(
                            "Investigate seasonal pattern changes",
                            "Update baseline patterns"))
                    .build());
        }
        return anomalies;
    }

    private Optional<MetricSample> latestInBucket(List<MetricSample> samples, int bucket, int period) {
        for (int i = samples.size() - 1; i >= 0; i--) {
            MetricSample sample = samples.get(i);
            long epochHour = Math.floorDiv(sample.timestamp().getEpochSecond(), 3600L);
            if (Math.floorMod(epochHour, period) == bucket) {
                return Optional.of(sample);
            }
        }
        return Optional.empty();
    }
}
