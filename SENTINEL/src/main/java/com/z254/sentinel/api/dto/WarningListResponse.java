package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.EarlyWarning;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for early-warning list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarningListResponse {
    private List<EarlyWarning> warnings;
    private int total;
}
