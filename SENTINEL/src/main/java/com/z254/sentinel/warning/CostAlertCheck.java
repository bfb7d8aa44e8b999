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
 * Warns when the current cost approaches the daily budget.
 */
@Component
public class CostAlertCheck implements WarningCheck {

    private final SentinelProperties sentinelProperties;

    public CostAlertCheck(SentinelProperties sentinelProperties) {
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public EarlyWarning.WarningType type() {
        return EarlyWarning.WarningType.COST_ALERT;
    }

    @Override
    public List<String> metrics() {
        return List.of(config().getMetric());
    }

    @Override
    public Optional<EarlyWarning> evaluate(String metric, List<MetricSample> samples) {
        SentinelProperties.Warning.Cost config = config();
        double budget = config.getDailyBudget();
        double currentCost = samples.get(samples.size() - 1).value();

        if (currentCost <= budget * config.getWarnRatio()) {
            return Optional.empty();
        }

        OptionalDouble projection = BreachProjection.projectValue(samples, config.getHorizonMinutes());
        if (projection.isEmpty()) {
            return Optional.empty();
        }
        double projectedCost = projection.getAsDouble();
        Severity severity = currentCost > budget * config.getCriticalRatio() ? Severity.CRITICAL : Severity.HIGH;

        Map<String, Object> context = new HashMap<>();
        context.put("dailyBudget", budget);
        context.put("projectedCost", projectedCost);

        return Optional.of(EarlyWarning.builder()
                .id(UUID.randomUUID().toString())
                .type(type())
                .severity(severity)
                .title("Daily budget approaching limit")
                .description(String.format("Current cost is %d (%d%% of daily budget)",
                        Math.round(currentCost), Math.round(currentCost / budget * 100)))
                .metric(metric)
                .currentValue(currentCost)
                .threshold(budget)
                .projectedValue(projectedCost)
                .timeToBreach(BreachProjection.timeToBreach(
                        currentCost, projectedCost, budget, config.getHorizonMinutes()))
                .confidence(config.getConfidence())
                .context(context)
                .actions(List.of(WarningAction.builder()
                        .action("Review and optimize costs")
                        .priority(severity)
                        .timeframe("immediate")
                        .impact("Prevent budget overrun")
                        .build()))
                .createdAt(Instant.now())
                .build());
    }

    private SentinelProperties.Warning.Cost config() {
        return sentinelProperties.getWarning().getCost();
    }
}
