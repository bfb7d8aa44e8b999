package com.z254.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.*;

/**
 * A projected future breach of a monitored value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EarlyWarning {

    /** Unique warning identifier */
    private String id;

    private WarningType type;

    private Severity severity;

    private String title;

    private String description;

    private String metric;

    private double currentValue;

    private double threshold;

    private double projectedValue;

    /** Projected minutes until the threshold is crossed; positive infinity when never */
    private double timeToBreach;

    /** Confidence score (0.0 to 1.0) */
    private double confidence;

    /** Check-specific details (trend, budget, utilization...) */
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    /** Recommended actions, most urgent first */
    @Builder.Default
    private List<WarningAction> actions = new ArrayList<>();

    @Builder.Default
    private WarningStatus status = WarningStatus.ACTIVE;

    private Instant createdAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    private Instant resolvedAt;

    private Instant dismissedAt;

    public boolean isActive() {
        return status == WarningStatus.ACTIVE;
    }

    /**
     * Whether the warning is still open, i.e. active or acknowledged.
     */
    public boolean isOpen() {
        return status == WarningStatus.ACTIVE || status == WarningStatus.ACKNOWLEDGED;
    }

    public boolean acknowledge(String userId) {
        if (status != WarningStatus.ACTIVE) {
            return false;
        }
        this.status = WarningStatus.ACKNOWLEDGED;
        this.acknowledgedAt = Instant.now();
        this.acknowledgedBy = userId;
        return true;
    }

    public boolean resolve() {
        if (!isOpen()) {
            return false;
        }
        this.status = WarningStatus.RESOLVED;
        this.resolvedAt = Instant.now();
        return true;
    }

    public boolean dismiss() {
        if (!isOpen()) {
            return false;
        }
        this.status = WarningStatus.DISMISSED;
        this.dismissedAt = Instant.now();
        return true;
    }

    /**
     * Copy that does not share mutable collections with this instance.
     */
    public EarlyWarning snapshot() {
        return toBuilder()
                .context(new HashMap<>(context))
                .actions(new ArrayList<>(actions))
                .build();
    }

    /**
     * Warning types.
     */
    public enum WarningType {
        THRESHOLD_BREACH,
        TREND_ALERT,
        CAPACITY_WARNING,
        COST_ALERT,
        PERFORMANCE_DEGRADATION
    }

    /**
     * Warning lifecycle status.
     */
    public enum WarningStatus {
        ACTIVE,
        ACKNOWLEDGED,
        RESOLVED,
        DISMISSED
    }

    /**
     * Recommended action attached to a warning.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WarningAction {
        private String action;
        private Severity priority;
        private String timeframe;
        private String impact;
    }
}
