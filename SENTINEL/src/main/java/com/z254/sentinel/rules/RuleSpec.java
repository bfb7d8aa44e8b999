package com.z254.sentinel.rules;

import com.z254.sentinel.domain.model.DetectionRule.RuleParameters;

/**
 * Requested configuration of a new detection rule.
 *
 * @param name       display name; defaults to the metric and algorithm when blank
 * @param metric     watched metric, required
 * @param algorithm  one of statistical, machine_learning, threshold, pattern_based (any case)
 * @param parameters optional tuning parameters
 * @param enabled    initial state; {@code null} means enabled
 */
public record RuleSpec(String name,
                       String metric,
                       String algorithm,
                       RuleParameters parameters,
                       Boolean enabled) {
}
