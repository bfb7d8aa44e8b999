package com.z254.sentinel.warning;

import com.z254.sentinel.config.SentinelProperties;
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
 * Warns when a utilization metric close to its limit is projected to cross it soon.
 */
@Component
public class ThresholdBreachCheck implements WarningCheck {

    private final SentinelProperties sentinelProperties;

    public ThresholdBreachCheck(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public EarlyWarning.WarningType type() {
        return EarlyWarning.WarningType.THRESHOLD_BREACH;
    }

    @Override
    public List<String> metrics() {
        return config().getMetrics();
    }

    @Override
    public Optional<EarlyWarning> evaluate(String metric, List<MetricSample> samples) {
        SentinelProperties.Warning.Threshold config = config();
        double current = samples.get(samples.size() - 1).value();
        double threshold = thresholdFor(metric);

        if (current <= threshold * config.getProximityRatio()) {
            return Optional.empty();
        }

        OptionalDouble projected = BreachProjection.projectValue(samples, config.getHorizonMinutes());
        if (projected.isEmpty()) {
            return Optional.empty();
        }

        double timeToBreach = BreachProjection.timeToBreach(
                current, projected.getAsDouble(), threshold, config.getHorizonMinutes());
        if (timeToBreach >= config.getBreachWindowMinutes()) {
            return Optional.empty();
        }

        Severity severity = timeToBreach < config.getCriticalBreachMinutes() ? Severity.CRITICAL : Severity.HIGH;

        Map<String, Object> context = new HashMap<>();
        context.put("metric", metric);
        context.put("threshold", threshold);

        return Optional.of(EarlyWarning.builder()
                .id(UUID.randomUUID().toString())
                .type(type())
                .severity(severity)
                .title(metric + " approaching threshold")
                .description(metric + " utilization is approaching the threshold of " + threshold)
                .metric(metric)
                .currentValue(current)
                .threshold(threshold)
                .projectedValue(projected.getAsDouble())
                .timeToBreach(timeToBreach)
                .confidence(config.getConfidence())
                .context(context)
                .actions(List.of(WarningAction.builder()
                        .action("Scale resources")
                        .priority(severity)
                        .timeframe("immediate")
                        .impact("Prevent service degradation")
                        .build()))
                .createdAt(Instant.now())
                .build());
    }

    double thresholdFor(String metric) {
        SentinelProperties.Warning.Threshold config = config();
        return config.getLimits().getOrDefault(metric, config.getDefaultLimit());
    }

    private SentinelProperties.Warning.Threshold config() {
        return sentinelProperties.getWarning().getThreshold();
    }
}
