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
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Flags recent samples lying more than the configured number of standard deviations away from
 * the baseline mean, and classifies each outlier as a spike, drop, trend change or plain outlier.
 */
@Slf4j
@Component
public class StatisticalOutlierDetector implements AnomalyDetector {

    private final SentinelProperties sentinelProperties;
    private final AnomalyNarrator narrator;

    public StatisticalOutlierDetector(SentinelProperties sentinelProperties, AnomalyNarrator narrator) {
        this.sentinelProperties = sentinelProperties;
        this.narrator = narrator;
    }

    @Override
    public String name() {
        return "statistical";
    }

    @Override
    public List<AnomalyDetection> detect(MetricWindows windows) {
        SentinelProperties.Detection config = sentinelProperties.getDetection();
        double mean = SeriesStatistics.mean(windows.baseline());
        double stdDev = SeriesStatistics.standardDeviation(windows.baseline());

        if (stdDev == 0.0) {
            log.debug("Baseline of {} is constant, skipping outlier detection", windows.metric());
            return List.of();
        }

        List<MetricSample> recent = windows.recent();
        List<AnomalyDetection> anomalies = new ArrayList<>();

        for (int i = 0; i < recent.size(); i++) {
            MetricSample sample = recent.get(i);
            double deviation = Math.abs(sample.value() - mean) / stdDev;
            if (deviation <= config.getSigmaThreshold()) {
                continue;
            }

            AnomalyType type = classify(recent, i, mean);
            Severity severity = severityFor(deviation);

            anomalies.add(AnomalyDetection.builder()
                    .id(UUID.randomUUID().toString())
                    .metric(windows.metric())
                    .detectedAt(sample.timestamp())
                    .anomalyType(type)
                    .severity(severity)
                    .description(narrator.describe(windows.metric(), type, mean, sample.value()))
                    .expectedValue(mean)
                    .actualValue(sample.value())
                    .deviation(deviation)
                    .confidence(SeriesStatistics.clamp01(deviation / 4.0))
                    .recommendations(narrator.recommend(type, severity))
                    .build());
        }
        return anomalies;
    }

    /**
     * Severity bands by deviation in standard deviations.
     */
    static Severity severityFor(double deviation) {
        if (deviation > 4.0) return Severity.CRITICAL;
        if (deviation > 3.0) return Severity.HIGH;
        if (deviation > 2.5) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private AnomalyType classify(List<MetricSample> recent, int index, double mean) {
        SentinelProperties.Detection config = sentinelProperties.getDetection();
        double value = recent.get(index).value();

        if (value > mean * config.getSpikeMultiplier()) {
            return AnomalyType.SPIKE;
        }
        if (value < mean * config.getDropMultiplier()) {
            return AnomalyType.DROP;
        }

        // the first sample with a full window of preceding points is index == points
        int points = config.getLocalTrendPoints();
        if (index >= points) {
            OptionalDouble localTrend = SeriesStatistics.trend(recent.subList(index - points + 1, index + 1));
            if (localTrend.isPresent() && Math.abs(localTrend.getAsDouble()) > config.getLocalTrendThreshold()) {
                return AnomalyType.TREND_CHANGE;
            }
        }
        return AnomalyType.OUTLIER;
    }
}
