package com.z254.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolution of an anomaly; {@code false_positive} marks it as a false positive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {
    @NotBlank
    private String resolution;
}
