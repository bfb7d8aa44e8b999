package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Reports a change of the overall trend between the baseline and the recent window.
 */
@Component
public class TrendChangeDetector implements AnomalyDetector {

    static final double CONFIDENCE = 0.8;

    private final SentinelProperties sentinelProperties;

    public TrendChangeDetector(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public String name() {
        return "trend";
    }

    @Override
    public List<AnomalyDetection> detect(MetricWindows windows) {
        SentinelProperties.Detection config = sentinelProperties.getDetection();
        int minSamples = config.getMinTrendSamples();
        if (windows.recent().size() < minSamples || windows.baseline().size() < minSamples) {
            return List.of();
        }

        OptionalDouble recentTrend = SeriesStatistics.trend(windows.recent());
        OptionalDouble baselineTrend = SeriesStatistics.trend(windows.baseline());
        if (recentTrend.isEmpty() || baselineTrend.isEmpty()) {
            return List.of();
        }

        double change = Math.abs(recentTrend.getAsDouble() - baselineTrend.getAsDouble());
        if (change <= config.getTrendChangeThreshold()) {
            return List.of();
        }

        MetricSample lastRecent = windows.recent().get(windows.recent().size() - 1);
        MetricSample lastBaseline = windows.baseline().get(windows.baseline().size() - 1);
        String direction = recentTrend.getAsDouble() > baselineTrend.getAsDouble() ? "increasing" : "decreasing";

        return List.of(AnomalyDetection.builder()
                .id(UUID.randomUUID().toString())
                .metric(windows.metric())
                .detectedAt(lastRecent.timestamp())
                .anomalyType(AnomalyType.TREND_CHANGE)
                .severity(change > config.getHighTrendChangeThreshold() ? Severity.HIGH : Severity.MEDIUM)
                .description("Significant trend change detected: " + direction)
                .expectedValue(lastBaseline.value())
                .actualValue(lastRecent.value())
                .deviation(change)
                .confidence(CONFIDENCE)
                .recommendations(List.of(
                        "Investigate trend change causes",
                        "Update forecasting models"))
                .build());
    }
}
