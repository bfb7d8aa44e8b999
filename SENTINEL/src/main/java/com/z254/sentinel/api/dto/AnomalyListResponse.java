package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.AnomalyDetection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for anomaly list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyListResponse {
    private List<AnomalyDetection> anomalies;
    private int total;
}
