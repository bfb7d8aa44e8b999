package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;

import java.util.List;

/**
 * Recent samples of a metric together with the baseline they are compared against.
 *
 * @param metric        metric name
 * @param recentRange   the inspected range
 * @param baselineRange the equal-length range immediately before it
 * @param recent        samples in the recent range, oldest first
 * @param baseline      samples in the baseline range, oldest first; empty when not fetched
 */
public record MetricWindows(String metric,
                            TimeRange recentRange,
                            TimeRange baselineRange,
                            List<MetricSample> recent,
                            List<MetricSample> baseline) {

    public MetricWindows {
        recent = List.copyOf(recent);
        baseline = List.copyOf(baseline);
    }

    public boolean hasEnoughData(int minRecent, int minBaseline) {
        return recent.size() >= minRecent && baseline.size() >= minBaseline;
    }
}
