package com.z254.sentinel.rules;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.DetectionRule;
import com.z254.sentinel.domain.model.DetectionRule.RuleAlgorithm;
import com.z254.sentinel.domain.model.DetectionRule.RuleParameters;
import com.z254.sentinel.domain.model.RulePerformance;
import com.z254.sentinel.domain.repository.AnomalyRepository;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.RuleEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of detection rules and their trigger statistics.
 * <p>
 * Rules are metadata: the built-in detectors run regardless of them. Anomalies are attributed
 * to every enabled rule watching their metric, and each detection pass producing attributed
 * anomalies counts as one trigger of the rule.
 */
@Slf4j
@Component
public class DetectionRuleRegistry {

    private final Map<String, DetectionRule> rules = new ConcurrentHashMap<>();
    private final AnomalyRepository anomalyRepository;
    private final SentinelStructuredLogger structuredLogger;

    public DetectionRuleRegistry(SentinelProperties sentinelProperties,
                                 AnomalyRepository anomalyRepository,
                                 SentinelStructuredLogger structuredLogger) {
        this.anomalyRepository = anomalyRepository;
        this.structuredLogger = structuredLogger;

        if (sentinelProperties.getRules().isSeedDefaults()) {
            seedDefaultRules();
        }
    }

    /**
     * Validate and register a rule.
     *
     * @return the new rule ID
     * @throws RuleValidationException if the metric is blank or the algorithm unknown
     */
    public String createRule(RuleSpec spec) {
        if (spec == null) {
            throw new RuleValidationException("Rule specification is required");
        }
        if (spec.metric() == null || spec.metric().isBlank()) {
            throw new RuleValidationException("Rule metric must not be empty");
        }
        RuleAlgorithm algorithm = parseAlgorithm(spec.algorithm());

        String name = spec.name() == null || spec.name().isBlank()
                ? spec.metric() + " " + algorithm.name().toLowerCase()
                : spec.name();

        DetectionRule rule = DetectionRule.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .metric(spec.metric().trim())
                .algorithm(algorithm)
                .parameters(spec.parameters() != null ? copyOf(spec.parameters()) : new RuleParameters())
                .enabled(spec.enabled() == null || spec.enabled())
                .createdAt(Instant.now())
                .build();
        rules.put(rule.getId(), rule);

        structuredLogger.logRuleEvent(rule.getId(), RuleEventType.RULE_CREATED, "Detection rule created",
                Map.of("metric", rule.getMetric(), "algorithm", algorithm.name()));
        return rule.getId();
    }

    public List<DetectionRule> listRules() {
        return rules.values().stream()
                .map(this::copyOf)
                .sorted(Comparator.comparing(DetectionRule::getCreatedAt)
                        .thenComparing(DetectionRule::getId))
                .toList();
    }

    public Optional<DetectionRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId)).map(this::copyOf);
    }

    public Optional<DetectionRule> setRuleEnabled(String ruleId, boolean enabled) {
        DetectionRule updated = rules.computeIfPresent(ruleId, (id, rule) -> {
            rule.setEnabled(enabled);
            return rule;
        });
        if (updated == null) {
            return Optional.empty();
        }
        structuredLogger.logRuleEvent(ruleId, enabled ? RuleEventType.RULE_ENABLED : RuleEventType.RULE_DISABLED,
                enabled ? "Detection rule enabled" : "Detection rule disabled", null);
        return Optional.of(copyOf(updated));
    }

    /**
     * Attach the IDs of enabled rules watching each anomaly's metric.
     */
    public void attribute(List<AnomalyDetection> anomalies) {
        for (AnomalyDetection anomaly : anomalies) {
            rules.values().stream()
                    .filter(DetectionRule::isEnabled)
                    .filter(rule -> rule.getMetric().equals(anomaly.getMetric()))
                    .forEach(rule -> anomaly.getRuleIds().add(rule.getId()));
        }
    }

    /**
     * Count one trigger for every rule attributed to at least one of the anomalies of a pass.
     */
    public void recordTriggers(List<AnomalyDetection> passAnomalies) {
        Set<String> triggered = new HashSet<>();
        passAnomalies.forEach(anomaly -> triggered.addAll(anomaly.getRuleIds()));

        Instant now = Instant.now();
        for (String ruleId : triggered) {
            DetectionRule rule = rules.computeIfPresent(ruleId, (id, existing) -> {
                existing.setTriggerCount(existing.getTriggerCount() + 1);
                existing.setLastTriggered(now);
                return existing;
            });
            if (rule != null) {
                structuredLogger.logRuleEvent(ruleId, RuleEventType.RULE_TRIGGERED, "Detection rule triggered",
                        Map.of("triggerCount", rule.getTriggerCount()));
            }
        }
    }

    /**
     * Trigger statistics of a rule.
     * The false positive rate is the number of its anomalies resolved as false positives
     * divided by {@code max(1, triggerCount)}.
     */
    public Optional<RulePerformance> getRulePerformance(String ruleId) {
        DetectionRule rule = rules.get(ruleId);
        if (rule == null) {
            return Optional.empty();
        }

        long falsePositives = anomalyRepository.findAll().stream()
                .filter(anomaly -> anomaly.getStatus() == AnomalyDetection.AnomalyStatus.FALSE_POSITIVE)
                .filter(anomaly -> anomaly.getRuleIds().contains(ruleId))
                .count();
        long triggerCount = rule.getTriggerCount();

        return Optional.of(RulePerformance.builder()
                .ruleId(ruleId)
                .triggerCount(triggerCount)
                .falsePositiveCount(falsePositives)
                .falsePositiveRate((double) falsePositives / Math.max(1, triggerCount))
                .lastTriggered(rule.getLastTriggered())
                .build());
    }

    public int size() {
        return rules.size();
    }

    static RuleAlgorithm parseAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new RuleValidationException("Rule algorithm must not be empty");
        }
        try {
            return RuleAlgorithm.valueOf(algorithm.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleValidationException("Unknown rule algorithm '" + algorithm
                    + "', expected one of " + Arrays.toString(RuleAlgorithm.values()));
        }
    }

    private void seedDefaultRules() {
        Instant now = Instant.now();
        register(DetectionRule.builder()
                .id("statistical_outlier")
                .name("Statistical Outlier Detection")
                .metric("system_performance")
                .algorithm(RuleAlgorithm.STATISTICAL)
                .parameters(RuleParameters.builder().sensitivity(3.0).windowSize(24).build())
                .createdAt(now)
                .build());
        register(DetectionRule.builder()
                .id("utilization_threshold")
                .name("Utilization Threshold")
                .metric("compute")
                .algorithm(RuleAlgorithm.THRESHOLD)
                .parameters(RuleParameters.builder().threshold(0.8).build())
                .createdAt(now)
                .build());
        register(DetectionRule.builder()
                .id("cost_anomaly")
                .name("Cost Anomaly Detection")
                .metric("cost_analysis")
                .algorithm(RuleAlgorithm.STATISTICAL)
                .parameters(RuleParameters.builder().sensitivity(2.5).windowSize(48).build())
                .createdAt(now)
                .build());
        log.info("Seeded {} default detection rules", rules.size());
    }

    private void register(DetectionRule rule) {
        rules.put(rule.getId(), rule);
    }

    private DetectionRule copyOf(DetectionRule rule) {
        return rule.toBuilder().parameters(copyOf(rule.getParameters())).build();
    }

    private RuleParameters copyOf(RuleParameters parameters) {
        return RuleParameters.builder()
                .sensitivity(parameters.getSensitivity())
                .windowSize(parameters.getWindowSize())
                .threshold(parameters.getThreshold())
                .confidence(parameters.getConfidence())
                .build();
    }
}
