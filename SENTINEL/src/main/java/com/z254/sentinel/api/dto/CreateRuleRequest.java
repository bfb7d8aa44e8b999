package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.DetectionRule.RuleParameters;
import com.z254.sentinel.rules.RuleSpec;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a detection rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRuleRequest {

    private String name;

    @NotBlank
    private String metric;

    /** statistical, machine_learning, threshold or pattern_based */
    @NotBlank
    private String algorithm;

    private RuleParameters parameters;

    private Boolean enabled;

    public RuleSpec toSpec() {
        return new RuleSpec(name, metric, algorithm, parameters, enabled);
    }
}
