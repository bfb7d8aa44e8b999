package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * A detected deviation of a metric from its expected behaviour.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetection {

    /** Resolution text that marks an anomaly as a false positive */
    public static final String FALSE_POSITIVE_RESOLUTION = "false_positive";

    /** Unique anomaly identifier */
    private String id;

    /** Metric the anomaly was detected on */
    private String metric;

    /** Time of the observation the anomaly refers to */
    private Instant detectedAt;

    private AnomalyType anomalyType;

    private Severity severity;

    /** Human-readable summary */
    private String description;

    private double expectedValue;

    private double actualValue;

    /** Dimensionless deviation, never negative */
    private double deviation;

    /** Confidence score (0.0 to 1.0) */
    private double confidence;

    /** Optional project/user/component/region tags */
    @Builder.Default
    private Map<String, String> context = new HashMap<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.NEW;

    /** Detection rules this anomaly is attributed to */
    @Builder.Default
    private Set<String> ruleIds = new HashSet<>();

    private String assignedTo;

    private Instant acknowledgedAt;

    private Instant resolvedAt;

    private String resolution;

    /**
     * Key under which anomalies are considered the same occurrence:
     * metric, type and the time bucket of {@link #detectedAt}.
     */
    public String dedupKey(Duration bucket) {
        long bucketIndex = Math.floorDiv(detectedAt.toEpochMilli(), bucket.toMillis());
        return metric + "_" + anomalyType.name() + "_" + bucketIndex;
    }

    /**
     * Check if the anomaly still needs attention.
     */
    public boolean isActive() {
        return status == AnomalyStatus.NEW || status == AnomalyStatus.INVESTIGATING;
    }

    /**
     * Start investigating a new anomaly.
     *
     * @return {@code false}, leaving the anomaly unchanged, unless its status is {@code NEW}
     */
    public boolean acknowledge(String userId) {
        if (status != AnomalyStatus.NEW) {
            return false;
        }
        this.status = AnomalyStatus.INVESTIGATING;
        this.assignedTo = userId;
        this.acknowledgedAt = Instant.now();
        return true;
    }

    /**
     * Close an active anomaly. A {@value #FALSE_POSITIVE_RESOLUTION} resolution marks it as a false positive.
     *
     * @return {@code false}, leaving the anomaly unchanged, when it is already closed
     */
    public boolean resolve(String resolution) {
        if (!isActive()) {
            return false;
        }
        this.status = FALSE_POSITIVE_RESOLUTION.equalsIgnoreCase(resolution)
                ? AnomalyStatus.FALSE_POSITIVE
                : AnomalyStatus.RESOLVED;
        this.resolution = resolution;
        this.resolvedAt = Instant.now();
        return true;
    }

    /**
     * Copy that does not share mutable collections with this instance.
     */
    public AnomalyDetection snapshot() {
        return toBuilder()
                .context(new HashMap<>(context))
                .recommendations(new ArrayList<>(recommendations))
                .ruleIds(new HashSet<>(ruleIds))
                .build();
    }

    /**
     * Anomaly subtypes.
     */
    public enum AnomalyType {
        SPIKE,
        DROP,
        TREND_CHANGE,
        PATTERN_BREAK,
        SEASONAL_DEVIATION,
        OUTLIER
    }

    /**
     * Anomaly lifecycle status.
     */
    public enum AnomalyStatus {
        NEW,
        INVESTIGATING,
        RESOLVED,
        FALSE_POSITIVE
    }
}
