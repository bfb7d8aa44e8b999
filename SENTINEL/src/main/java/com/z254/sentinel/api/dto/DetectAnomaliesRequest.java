package com.z254.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for a synchronous detection pass on one metric.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class DetectAnomaliesRequest extends TimeRangeRequest {

    @NotBlank
    private String metric;

    public DetectAnomaliesRequest(String metric, Instant start, Instant end) {
        super(start, end);
        this.metric = metric;
    }
}
