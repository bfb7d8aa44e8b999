package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Trigger statistics of a detection rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RulePerformance {
    private String ruleId;
    private long triggerCount;
    private long falsePositiveCount;
    private double falsePositiveRate;
    private Instant lastTriggered;
}
