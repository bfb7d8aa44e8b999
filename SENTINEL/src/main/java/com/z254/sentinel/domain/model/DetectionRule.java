package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Configuration of a detection rule together with its trigger statistics.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRule {

    /** Unique rule identifier */
    private String id;

    private String name;

    /** Metric the rule watches */
    private String metric;

    private RuleAlgorithm algorithm;

    @Builder.Default
    private RuleParameters parameters = new RuleParameters();

    @Builder.Default
    private boolean enabled = true;

    /** Number of detection passes that produced anomalies attributed to this rule */
    @Builder.Default
    private long triggerCount = 0;

    private Instant lastTriggered;

    private Instant createdAt;

    /**
     * Rule algorithms.
     */
    public enum RuleAlgorithm {
        STATISTICAL,
        MACHINE_LEARNING,
        THRESHOLD,
        PATTERN_BASED
    }

    /**
     * Algorithm-dependent tuning parameters; all optional.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleParameters {
        private Double sensitivity;
        private Integer windowSize;
        private Double threshold;
        private Double confidence;
    }
}
