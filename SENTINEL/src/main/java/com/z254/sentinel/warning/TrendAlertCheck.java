package com.z254.sentinel.warning;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.detection.SeriesStatistics;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.model.EarlyWarning.WarningAction;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Warns about rapid growth of a usage metric.
 */
@Component
public class TrendAlertCheck implements WarningCheck {

    private final SentinelProperties sentinelProperties;

    public TrendAlertCheck(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public EarlyWarning.WarningType type() {
        return EarlyWarning.WarningType.TREND_ALERT;
    }

    @Override
    public List<String> metrics() {
        return config().getMetrics();
    }

    @Override
    public Optional<EarlyWarning> evaluate(String metric, List<MetricSample> samples) {
        SentinelProperties.Warning.Trend config = config();
        if (samples.size() < config.getMinSamples()) {
            return Optional.empty();
        }

        OptionalDouble trend = SeriesStatistics.trend(samples);
        if (trend.isEmpty() || trend.getAsDouble() <= config.getGrowthThreshold()) {
            return Optional.empty();
        }

        double growth = trend.getAsDouble();
        double current = samples.get(samples.size() - 1).value();
        double threshold = current * config.getTargetMultiplier();
        double projected = BreachProjection.projectValue(samples, config.getHorizonMinutes()).orElse(current);
        Severity severity = growth > config.getCriticalGrowth() ? Severity.CRITICAL : Severity.HIGH;

        Map<String, Object> context = new HashMap<>();
        context.put("metric", metric);
        context.put("trend", growth);

        return Optional.of(EarlyWarning.builder()
                .id(UUID.randomUUID().toString())
                .type(type())
                .severity(severity)
                .title("Rapid growth detected in " + metric)
                .description(String.format("%s showing %d%% growth rate", metric, Math.round(growth * 100)))
                .metric(metric)
                .currentValue(current)
                .threshold(threshold)
                .projectedValue(projected)
                .timeToBreach(BreachProjection.timeToBreach(current, projected, threshold, config.getHorizonMinutes()))
                .confidence(config.getConfidence())
                .context(context)
                .actions(List.of(WarningAction.builder()
                        .action("Prepare for capacity scaling")
                        .priority(severity)
                        .timeframe("24 hours")
                        .impact("Support projected growth")
                        .build()))
                .createdAt(Instant.now())
                .build());
    }

    private SentinelProperties.Warning.Trend config() {
        return sentinelProperties.getWarning().getTrend();
    }
}
