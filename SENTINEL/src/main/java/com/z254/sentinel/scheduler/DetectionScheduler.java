package com.z254.sentinel.scheduler;

import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.service.AnomalyDetectionService;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.PassEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives the periodic detection and warning loops.
 * <p>
 * The loops run independently of each other. A tick arriving while the previous pass of the
 * same loop is still running is skipped by {@link AnomalyDetectionService}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DetectionScheduler {

    private final AnomalyDetectionService detectionService;
    private final SentinelStructuredLogger structuredLogger;

    public DetectionScheduler(AnomalyDetectionService detectionService,
                              SentinelStructuredLogger structuredLogger) {
        this.detectionService = detectionService;
        this.structuredLogger = structuredLogger;
    }

    @Scheduled(fixedRateString = "${sentinel.detection.interval:PT15M}",
            initialDelayString = "${sentinel.detection.initial-delay:PT1M}")
    public void runDetectionLoop() {
        String passId = UUID.randomUUID().toString();
        try (var scope = structuredLogger.withPass(AnomalyDetectionService.DETECTION_LOOP, passId)) {
            structuredLogger.logPassEvent(AnomalyDetectionService.DETECTION_LOOP, passId,
                    PassEventType.PASS_STARTED, "Detection pass started", null);
            List<AnomalyDetection> anomalies = detectionService.runDetectionPass(null);
            structuredLogger.logPassEvent(AnomalyDetectionService.DETECTION_LOOP, passId,
                    PassEventType.PASS_COMPLETED, "Detection pass completed",
                    Map.of("anomalies", anomalies.size()));
        } catch (RuntimeException e) {
            structuredLogger.logPassEvent(AnomalyDetectionService.DETECTION_LOOP, passId,
                    PassEventType.PASS_FAILED, "Detection pass failed",
                    Map.of("error", String.valueOf(e.getMessage())));
            log.error("Detection pass {} failed", passId, e);
        }
    }

    @Scheduled(fixedRateString = "${sentinel.warning.interval:PT5M}",
            initialDelayString = "${sentinel.warning.initial-delay:PT30S}")
    public void runWarningLoop() {
        String passId = UUID.randomUUID().toString();
        try (var scope = structuredLogger.withPass(AnomalyDetectionService.WARNING_LOOP, passId)) {
            structuredLogger.logPassEvent(AnomalyDetectionService.WARNING_LOOP, passId,
                    PassEventType.PASS_STARTED, "Warning pass started", null);
            List<EarlyWarning> warnings = detectionService.generateEarlyWarnings(null);
            structuredLogger.logPassEvent(AnomalyDetectionService.WARNING_LOOP, passId,
                    PassEventType.PASS_COMPLETED, "Warning pass completed",
                    Map.of("warnings", warnings.size()));
        } catch (RuntimeException e) {
            structuredLogger.logPassEvent(AnomalyDetectionService.WARNING_LOOP, passId,
                    PassEventType.PASS_FAILED, "Warning pass failed",
                    Map.of("error", String.valueOf(e.getMessage())));
            log.error("Warning pass {} failed", passId, e);
        }
    }
}
