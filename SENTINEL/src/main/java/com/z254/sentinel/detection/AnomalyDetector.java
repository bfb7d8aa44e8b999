package com.z254.sentinel.detection;

import com.z254.sentinel.domain.model.AnomalyDetection;

import java.util.List;

/**
 * A detection technique applied to the windows of one metric.
 */
public interface AnomalyDetector {

    /**
     * Name used in logs and failure metrics.
     */
    String name();

    /**
     * Find anomalies in the recent window relative to the baseline.
     * Implementations return an empty list when their technique yields no signal.
     */
    List<AnomalyDetection> detect(MetricWindows windows);
}
