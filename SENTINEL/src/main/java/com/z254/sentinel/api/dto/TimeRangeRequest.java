package com.z254.sentinel.api.dto;

import com.z254.sentinel.domain.model.TimeRange;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Optional time range of a pass triggered through the API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeRangeRequest {
    private Instant start;
    private Instant end;

    /**
     * @return the requested range, or {@code null} for the configured default lookback
     * @throws IllegalArgumentException if only one bound is given or end precedes start
     */
    public TimeRange toTimeRange() {
        if (start == null && end == null) {
            return null;
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end are required when a time range is given");
        }
        return new TimeRange(start, end);
    }
}
