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
 * Warns when a resource runs at high utilization.
 */
@Component
public class CapacityWarningCheck implements WarningCheck {

    private final SentinelProperties sentinelProperties;

    public CapacityWarningCheck(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public EarlyWarning.WarningType type() {
        return EarlyWarning.WarningType.CAPACITY_WARNING;
    }

    @Override
    public List<String> metrics() {
        return config().getMetrics();
    }

    @Override
    public Optional<EarlyWarning> evaluate(String resource, List<MetricSample> samples) {
        SentinelProperties.Warning.Capacity config = config();
        double utilization = samples.get(samples.size() - 1).value();

        if (utilization <= config.getUtilizationThreshold()) {
            return Optional.empty();
        }

        OptionalDouble projection = BreachProjection.projectValue(samples, config.getHorizonMinutes());
        if (projection.isEmpty()) {
            return Optional.empty();
        }
        double projected = projection.getAsDouble();
        Severity severity = utilization > config.getCriticalUtilization() ? Severity.CRITICAL : Severity.HIGH;

        Map<String, Object> context = new HashMap<>();
        context.put("resource", resource);
        context.put("utilization", utilization);

        return Optional.of(EarlyWarning.builder()
                .id(UUID.randomUUID().toString())
                .type(type())
                .severity(severity)
                .title("High capacity utilization: " + resource)
                .description(String.format("%s utilization is at %d%%", resource, Math.round(utilization * 100)))
                .metric(resource)
                .currentValue(utilization)
                .threshold(config.getUtilizationThreshold())
                .projectedValue(projected)
                .timeToBreach(BreachProjection.timeToBreach(
                        utilization, projected, config.getLimit(), config.getHorizonMinutes()))
                .confidence(config.getConfidence())
                .context(context)
                .actions(List.of(WarningAction.builder()
                        .action("Scale up capacity")
                        .priority(severity)
                        .timeframe("immediate")
                        .impact("Prevent resource exhaustion")
                        .build()))
                .createdAt(Instant.now())
                .build());
    }

    private SentinelProperties.Warning.Capacity config() {
        return sentinelProperties.getWarning().getCapacity();
    }
}
