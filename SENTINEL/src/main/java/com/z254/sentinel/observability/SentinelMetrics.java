package com.z254.sentinel.observability;

import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.EarlyWarning;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for SENTINEL service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Anomalies detected and evicted</li>
 *     <li>Warnings raised and evicted</li>
 *     <li>Gateway and per-check failures</li>
 *     <li>Pass latency and skipped ticks</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Anomaly metrics
    private final Map<AnomalyDetection.AnomalyType, Counter> anomaliesByType = new ConcurrentHashMap<>();
    @Getter
    private final Counter anomaliesEvicted;
    private final AtomicInteger storedAnomalies;

    // Warning metrics
    private final Map<EarlyWarning.WarningType, Counter> warningsByType = new ConcurrentHashMap<>();
    @Getter
    private final Counter warningsEvicted;
    private final AtomicInteger storedWarnings;

    // Failure metrics
    @Getter
    private final Counter gatewayFailures;
    @Getter
    private final Counter checkFailures;

    // Pass metrics
    private final Timer detectionPassLatency;
    private final Timer warningPassLatency;
    private final Map<String, Counter> skippedPasses = new ConcurrentHashMap<>();

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.anomaliesEvicted = Counter.builder("sentinel.anomalies.evicted")
                .description("Anomalies evicted by the retention cap")
                .register(meterRegistry);
        this.storedAnomalies = meterRegistry.gauge("sentinel.anomalies.stored", new AtomicInteger(0));

        this.warningsEvicted = Counter.builder("sentinel.warnings.evicted")
                .description("Warnings evicted by the retention cap")
                .register(meterRegistry);
        this.storedWarnings = meterRegistry.gauge("sentinel.warnings.stored", new AtomicInteger(0));

        this.gatewayFailures = Counter.builder("sentinel.gateway.failures")
                .description("Metric gateway calls that failed or timed out")
                .register(meterRegistry);
        this.checkFailures = Counter.builder("sentinel.check.failures")
                .description("Detectors or warning checks that failed")
                .register(meterRegistry);

        this.detectionPassLatency = Timer.builder("sentinel.detection.pass")
                .description("Detection pass duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.warningPassLatency = Timer.builder("sentinel.warning.pass")
                .description("Warning pass duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Anomaly Methods ==========

    public void recordAnomalyDetected(AnomalyDetection.AnomalyType type) {
        anomaliesByType.computeIfAbsent(type, t ->
                Counter.builder("sentinel.anomalies.detected")
                        .tag("type", t.name().toLowerCase())
                        .description("Anomalies detected")
                        .register(meterRegistry))
                .increment();
    }

    public void recordAnomaliesEvicted(int count) {
        anomaliesEvicted.increment(count);
    }

    public void updateStoredAnomalies(int size) {
        storedAnomalies.set(size);
    }

    // ========== Warning Methods ==========

    public void recordWarningRaised(EarlyWarning.WarningType type) {
        warningsByType.computeIfAbsent(type, t ->
                Counter.builder("sentinel.warnings.raised")
                        .tag("type", t.name().toLowerCase())
                        .description("Early warnings raised")
                        .register(meterRegistry))
                .increment();
    }

    public void recordWarningsEvicted(int count) {
        warningsEvicted.increment(count);
    }

    public void updateStoredWarnings(int size) {
        storedWarnings.set(size);
    }

    // ========== Failure Methods ==========

    public void recordGatewayFailure() {
        gatewayFailures.increment();
    }

    public void recordCheckFailure() {
        checkFailures.increment();
    }

    // ========== Pass Methods ==========

    public Timer.Sample startPassTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDetectionPass(Timer.Sample sample) {
        sample.stop(detectionPassLatency);
    }

    public void recordWarningPass(Timer.Sample sample) {
        sample.stop(warningPassLatency);
    }

    public void recordPassSkipped(String loop) {
        skippedPasses.computeIfAbsent(loop, l ->
                Counter.builder("sentinel.passes.skipped")
                        .tag("loop", l)
                        .description("Scheduler ticks skipped because the previous pass was still running")
                        .register(meterRegistry))
                .increment();
    }
}
