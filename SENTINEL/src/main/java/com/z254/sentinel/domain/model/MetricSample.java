package com.z254.sentinel.domain.model;

import java.time.Instant;

/**
 * One aggregated observation of a metric, as returned by the metric gateway.
 */
public record MetricSample(Instant timestamp, double value) {
}
