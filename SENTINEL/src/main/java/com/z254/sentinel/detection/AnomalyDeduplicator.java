package com.z254.sentinel.detection;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses anomalies of one pass that share a deduplication key, keeping the first.
 */
@Component
public class AnomalyDeduplicator {

    private final Duration bucket;

    public AnomalyDeduplicator(SentinelProperties sentinelProperties) {
        this.bucket = sentinelProperties.getDetection().getDedupBucket();
    }

    public List<AnomalyDetection> deduplicate(List<AnomalyDetection> anomalies) {
        Map<String, AnomalyDetection> byKey = new LinkedHashMap<>();
        for (AnomalyDetection anomaly : anomalies) {
            byKey.putIfAbsent(anomaly.dedupKey(bucket), anomaly);
        }
        return List.copyOf(byKey.values());
    }
}
