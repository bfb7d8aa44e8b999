package com.z254.sentinel.domain.service;

import com.z254.sentinel.client.MetricGatewayException;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.detection.AnomalyDeduplicator;
import com.z254.sentinel.detection.AnomalyDetector;
import com.z254.sentinel.detection.MetricWindowManager;
import com.z254.sentinel.detection.MetricWindows;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.DetectionRule;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.model.RulePerformance;
import com.z254.sentinel.domain.model.Severity;
import com.z254.sentinel.domain.model.TimeRange;
import com.z254.sentinel.domain.repository.AnomalyRepository;
import com.z254.sentinel.domain.repository.EarlyWarningRepository;
import com.z254.sentinel.health.SentinelHealthIndicator;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.DetectionEventType;
import com.z254.sentinel.observability.SentinelStructuredLogger.PassEventType;
import com.z254.sentinel.observability.SentinelStructuredLogger.WarningEventType;
import com.z254.sentinel.rules.DetectionRuleRegistry;
import com.z254.sentinel.rules.RuleSpec;
import com.z254.sentinel.warning.EarlyWarningGenerator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Entry point of the anomaly detection and early-warning engine.
 * <p>
 * Runs detection and warning passes, keeps their results in the bounded stores and manages
 * the anomaly and warning lifecycles. Used by the scheduler and the REST API alike.
 */
@Slf4j
@Service
public class AnomalyDetectionService {

    public static final String DETECTION_LOOP = "detection";
    public static final String WARNING_LOOP = "warning";

    private final MetricWindowManager windowManager;
    private final List<AnomalyDetector> detectors;
    private final AnomalyDeduplicator deduplicator;
    private final EarlyWarningGenerator warningGenerator;
    private final DetectionRuleRegistry ruleRegistry;
    private final AnomalyRepository anomalyRepository;
    private final EarlyWarningRepository warningRepository;
    private final SentinelProperties sentinelProperties;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelHealthIndicator healthIndicator;

    private final AtomicBoolean detectionPassRunning = new AtomicBoolean(false);
    private final AtomicBoolean warningPassRunning = new AtomicBoolean(false);

    public AnomalyDetectionService(MetricWindowManager windowManager,
                                   List<AnomalyDetector> detectors,
                                   AnomalyDeduplicator deduplicator,
                                   EarlyWarningGenerator warningGenerator,
                                   DetectionRuleRegistry ruleRegistry,
                                   AnomalyRepository anomalyRepository,
                                   EarlyWarningRepository warningRepository,
                                   SentinelProperties sentinelProperties,
                                   SentinelMetrics metrics,
                                   SentinelStructuredLogger structuredLogger,
                                   SentinelHealthIndicator healthIndicator) {
        this.windowManager = windowManager;
        this.detectors = detectors;
        this.deduplicator = deduplicator;
        this.warningGenerator = warningGenerator;
        this.ruleRegistry = ruleRegistry;
        this.anomalyRepository = anomalyRepository;
        this.warningRepository = warningRepository;
        this.sentinelProperties = sentinelProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.healthIndicator = healthIndicator;
    }

    // ========== Passes ==========

    /**
     * Run one detection pass for a metric.
     * <p>
     * Insufficient data and gateway failures yield an empty result. Anomalies whose
     * deduplication key is already stored are returned as the stored instance. While
     * another detection pass is running, the call is skipped and returns an empty list.
     *
     * @param range recent window to inspect; the configured lookback ending now when {@code null}
     * @return the pass's anomalies as they are held in the store
     */
    public List<AnomalyDetection> detectAnomalies(String metric, TimeRange range) {
        if (!detectionPassRunning.compareAndSet(false, true)) {
            skipDetectionPass();
            return List.of();
        }
        try {
            return detectMetric(metric, range);
        } finally {
            detectionPassRunning.set(false);
        }
    }

    /**
     * Run one detection pass over every configured metric.
     * A failure of one metric never prevents detection on the others. While a pass is
     * running, further calls are skipped and return an empty list.
     */
    public List<AnomalyDetection> runDetectionPass(TimeRange range) {
        if (!detectionPassRunning.compareAndSet(false, true)) {
            skipDetectionPass();
            return List.of();
        }
        Timer.Sample sample = metrics.startPassTimer();
        List<AnomalyDetection> anomalies = new ArrayList<>();
        try {
            for (String metric : sentinelProperties.getDetection().getMetrics()) {
                try {
                    anomalies.addAll(detectMetric(metric, range));
                } catch (RuntimeException e) {
                    metrics.recordCheckFailure();
                    structuredLogger.logDetectionFailure(metric, "Detection failed for metric", null, e);
                }
            }
            healthIndicator.recordDetectionPass(Instant.now());
            return anomalies;
        } finally {
            metrics.recordDetectionPass(sample);
            detectionPassRunning.set(false);
        }
    }

    private void skipDetectionPass() {
        metrics.recordPassSkipped(DETECTION_LOOP);
        structuredLogger.logPassEvent(DETECTION_LOOP, null, PassEventType.PASS_SKIPPED,
                "Detection pass already running, skipping", null);
    }

    private List<AnomalyDetection> detectMetric(String metric, TimeRange range) {
        TimeRange recentRange = range != null
                ? range
                : TimeRange.endingAt(Instant.now(), sentinelProperties.getDetection().getDefaultLookback());

        structuredLogger.logDetectionEvent(metric, DetectionEventType.DETECTION_STARTED, "Detection started",
                Map.of("start", recentRange.start().toString(), "end", recentRange.end().toString()));

        MetricWindows windows;
        try {
            windows = structuredLogger.timed("load-windows:" + metric,
                    () -> windowManager.loadWindows(metric, recentRange));
        } catch (MetricGatewayException e) {
            metrics.recordGatewayFailure();
            structuredLogger.logDetectionEvent(metric, DetectionEventType.GATEWAY_FAILURE,
                    "Skipping metric after gateway failure", Map.of("error", String.valueOf(e.getMessage())));
            return List.of();
        }

        SentinelProperties.Detection config = sentinelProperties.getDetection();
        if (!windows.hasEnoughData(config.getMinRecentSamples(), config.getMinBaselineSamples())) {
            structuredLogger.logDetectionEvent(metric, DetectionEventType.INSUFFICIENT_DATA,
                    "Not enough samples for detection",
                    Map.of("recent", windows.recent().size(), "baseline", windows.baseline().size()));
            return List.of();
        }

        List<AnomalyDetection> found = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                found.addAll(detector.detect(windows));
            } catch (RuntimeException e) {
                metrics.recordCheckFailure();
                structuredLogger.logDetectionFailure(metric, "Detector failed",
                        Map.of("detector", detector.name()), e);
            }
        }

        List<AnomalyDetection> unique = deduplicator.deduplicate(found);
        ruleRegistry.attribute(unique);
        List<AnomalyDetection> stored = anomalyRepository.saveAll(unique);
        ruleRegistry.recordTriggers(stored);

        // stored instances carrying an ID of this pass were newly inserted
        Set<String> passIds = new HashSet<>();
        unique.forEach(anomaly -> passIds.add(anomaly.getId()));
        for (AnomalyDetection anomaly : stored) {
            if (!passIds.contains(anomaly.getId())) {
                continue;
            }
            metrics.recordAnomalyDetected(anomaly.getAnomalyType());
            structuredLogger.logDetectionEvent(metric, DetectionEventType.ANOMALY_DETECTED,
                    anomaly.getDescription(),
                    Map.of("type", anomaly.getAnomalyType().name(),
                            "severity", anomaly.getSeverity().name(),
                            "deviation", anomaly.getDeviation()));
        }
        structuredLogger.logDetectionEvent(metric, DetectionEventType.DETECTION_COMPLETED,
                "Detection completed", Map.of("found", found.size(), "returned", stored.size()));
        return stored;
    }

    /**
     * Run one warning pass and store the raised warnings.
     * While a pass is running, further calls are skipped and return an empty list.
     *
     * @param range window the checks read; the configured lookback ending now when {@code null}
     */
    public List<EarlyWarning> generateEarlyWarnings(TimeRange range) {
        if (!warningPassRunning.compareAndSet(false, true)) {
            metrics.recordPassSkipped(WARNING_LOOP);
            structuredLogger.logPassEvent(WARNING_LOOP, null, PassEventType.PASS_SKIPPED,
                    "Warning pass already running, skipping", null);
            return List.of();
        }
        try {
            return runWarningPass(range);
        } finally {
            warningPassRunning.set(false);
        }
    }

    private List<EarlyWarning> runWarningPass(TimeRange range) {
        TimeRange recentRange = range != null
                ? range
                : TimeRange.endingAt(Instant.now(), sentinelProperties.getWarning().getDefaultLookback());

        Timer.Sample sample = metrics.startPassTimer();
        try {
            List<EarlyWarning> stored = warningRepository.saveAll(warningGenerator.generate(recentRange));
            healthIndicator.recordWarningPass(Instant.now());
            return stored;
        } finally {
            metrics.recordWarningPass(sample);
        }
    }

    // ========== Anomaly Queries & Lifecycle ==========

    public List<AnomalyDetection> getActiveAnomalies() {
        return findAnomalies(new AnomalyFilter(null, null, true, null));
    }

    public List<AnomalyDetection> findAnomalies(AnomalyFilter filter) {
        return anomalyRepository.findAll().stream()
                .filter(anomaly -> !filter.activeOnly() || anomaly.isActive())
                .filter(anomaly -> filter.metric() == null || filter.metric().equals(anomaly.getMetric()))
                .filter(anomaly -> filter.status() == null || filter.status() == anomaly.getStatus())
                .sorted(Comparator.comparing(AnomalyDetection::getDetectedAt).reversed())
                .limit(filter.limit() != null ? filter.limit() : Long.MAX_VALUE)
                .toList();
    }

    public Optional<AnomalyDetection> getAnomaly(String anomalyId) {
        return anomalyRepository.findById(anomalyId);
    }

    /**
     * Move a new anomaly to investigating.
     *
     * @return {@code false} when the anomaly is unknown or no longer new
     */
    public boolean acknowledgeAnomaly(String anomalyId, String userId) {
        return updateAnomaly(anomalyId, anomaly -> anomaly.acknowledge(userId),
                DetectionEventType.ANOMALY_ACKNOWLEDGED, "Anomaly acknowledged");
    }

    /**
     * Resolve an anomaly; a resolution of {@value AnomalyDetection#FALSE_POSITIVE_RESOLUTION}
     * marks it as a false positive. Closed anomalies are left unchanged and yield {@code false}.
     */
    public boolean resolveAnomaly(String anomalyId, String resolution) {
        return updateAnomaly(anomalyId, anomaly -> anomaly.resolve(resolution),
                DetectionEventType.ANOMALY_RESOLVED, "Anomaly resolved");
    }

    // ========== Warning Queries & Lifecycle ==========

    public List<EarlyWarning> getActiveWarnings() {
        return findWarnings(new WarningFilter(null, null, true, null));
    }

    public List<EarlyWarning> findWarnings(WarningFilter filter) {
        return warningRepository.findAll().stream()
                .filter(warning -> !filter.activeOnly() || warning.isActive())
                .filter(warning -> filter.type() == null || filter.type() == warning.getType())
                .filter(warning -> filter.severity() == null || filter.severity() == warning.getSeverity())
                .sorted(Comparator.comparing(EarlyWarning::getCreatedAt).reversed())
                .limit(filter.limit() != null ? filter.limit() : Long.MAX_VALUE)
                .toList();
    }

    public Optional<EarlyWarning> getWarning(String warningId) {
        return warningRepository.findById(warningId);
    }

    /**
     * Acknowledge an active warning; other statuses are left unchanged and yield {@code false}.
     */
    public boolean acknowledgeWarning(String warningId, String userId) {
        return updateWarning(warningId, warning -> warning.acknowledge(userId),
                WarningEventType.ACKNOWLEDGED, "Warning acknowledged");
    }

    public boolean resolveWarning(String warningId) {
        return updateWarning(warningId, EarlyWarning::resolve, WarningEventType.RESOLVED, "Warning resolved");
    }

    public boolean dismissWarning(String warningId) {
        return updateWarning(warningId, EarlyWarning::dismiss, WarningEventType.DISMISSED, "Warning dismissed");
    }

    // ========== Rules ==========

    public String createDetectionRule(RuleSpec spec) {
        return ruleRegistry.createRule(spec);
    }

    public Optional<RulePerformance> getRulePerformance(String ruleId) {
        return ruleRegistry.getRulePerformance(ruleId);
    }

    public List<DetectionRule> listRules() {
        return ruleRegistry.listRules();
    }

    public Optional<DetectionRule> getRule(String ruleId) {
        return ruleRegistry.getRule(ruleId);
    }

    public Optional<DetectionRule> setRuleEnabled(String ruleId, boolean enabled) {
        return ruleRegistry.setRuleEnabled(ruleId, enabled);
    }

    // ========== Summary ==========

    public EngineSummary getSummary() {
        List<AnomalyDetection> activeAnomalies = getActiveAnomalies();
        List<EarlyWarning> activeWarnings = getActiveWarnings();

        Map<Severity, Long> anomaliesBySeverity = new EnumMap<>(Severity.class);
        activeAnomalies.forEach(a -> anomaliesBySeverity.merge(a.getSeverity(), 1L, Long::sum));
        Map<Severity, Long> warningsBySeverity = new EnumMap<>(Severity.class);
        activeWarnings.forEach(w -> warningsBySeverity.merge(w.getSeverity(), 1L, Long::sum));

        return new EngineSummary(
                activeAnomalies.size(),
                activeWarnings.size(),
                anomaliesBySeverity,
                warningsBySeverity,
                activeAnomalies.stream().limit(EngineSummary.RECENT_LIMIT).toList(),
                activeWarnings.stream().limit(EngineSummary.RECENT_LIMIT).toList(),
                ruleRegistry.size());
    }

    // ========== Private Methods ==========

    private boolean updateAnomaly(String anomalyId, Predicate<AnomalyDetection> transition,
                                  DetectionEventType eventType, String message) {
        AtomicBoolean applied = new AtomicBoolean(false);
        Optional<AnomalyDetection> updated = anomalyRepository.update(anomalyId,
                anomaly -> applied.set(transition.test(anomaly)));
        if (updated.isEmpty()) {
            return false;
        }
        AnomalyDetection anomaly = updated.get();
        if (!applied.get()) {
            log.debug("Rejected {} for anomaly {} in status {}", eventType, anomalyId, anomaly.getStatus());
            return false;
        }
        structuredLogger.logDetectionEvent(anomaly.getMetric(), eventType, message,
                Map.of("anomalyId", anomalyId, "status", anomaly.getStatus().name()));
        return true;
    }

    private boolean updateWarning(String warningId, Predicate<EarlyWarning> transition,
                                  WarningEventType eventType, String message) {
        AtomicBoolean applied = new AtomicBoolean(false);
        Optional<EarlyWarning> updated = warningRepository.update(warningId,
                warning -> applied.set(transition.test(warning)));
        if (updated.isEmpty()) {
            return false;
        }
        EarlyWarning warning = updated.get();
        if (!applied.get()) {
            log.debug("Rejected {} for warning {} in status {}", eventType, warningId, warning.getStatus());
            return false;
        }
        structuredLogger.logWarningEvent(warning.getMetric(), eventType, message,
                Map.of("warningId", warningId, "status", warning.getStatus().name()));
        return true;
    }

    /**
     * Anomaly query criteria; {@code null} fields do not filter.
     */
    public record AnomalyFilter(String metric,
                                AnomalyDetection.AnomalyStatus status,
                                boolean activeOnly,
                                Integer limit) {
    }

    /**
     * Warning query criteria; {@code null} fields do not filter.
     */
    public record WarningFilter(EarlyWarning.WarningType type,
                                Severity severity,
                                boolean activeOnly,
                                Integer limit) {
    }

    /**
     * Counts and most recent entries of the active anomalies and warnings.
     */
    public record EngineSummary(int activeAnomalies,
                                int activeWarnings,
                                Map<Severity, Long> anomaliesBySeverity,
                                Map<Severity, Long> warningsBySeverity,
                                List<AnomalyDetection> recentAnomalies,
                                List<EarlyWarning> recentWarnings,
                                int rules) {
        static final int RECENT_LIMIT = 10;
    }
}
