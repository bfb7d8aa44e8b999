package com.z254.sentinel.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging utility for SENTINEL service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for pass and metric identifiers</li>
 *     <li>Domain-specific logging methods for detection, warnings and rules</li>
 *     <li>Performance timing utilities</li>
 * </ul>
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_PASS_ID = "passId";
    public static final String MDC_LOOP = "loop";
    public static final String MDC_METRIC = "metric";
    public static final String MDC_RULE_ID = "ruleId";

    /**
     * Log a detection event for a metric.
     */
    public void logDetectionEvent(String metric, DetectionEventType eventType,
                                  String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_METRIC, metric))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("metric", metric);

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case GATEWAY_FAILURE, INSUFFICIENT_DATA, DETECTOR_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case ANOMALY_DETECTED, ANOMALY_ACKNOWLEDGED, ANOMALY_RESOLVED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a failed detection step together with its stack trace.
     */
    public void logDetectionFailure(String metric, String message, Map<String, Object> details, Throwable error) {
        try (var scope = withContext(Map.of(MDC_METRIC, metric))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", DetectionEventType.DETECTOR_FAILED.name());
            logData.put("metric", metric);

            if (details != null) {
                logData.putAll(details);
            }
            log.error("{} | data={}", message, formatLogData(logData), error);
        }
    }

    /**
     * Log an early-warning event.
     */
    public void logWarningEvent(String metric, WarningEventType eventType,
                                String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_METRIC, metric))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("metric", metric);

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case WARNING_RAISED, CHECK_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case ACKNOWLEDGED, RESOLVED, DISMISSED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a failed warning check together with its stack trace.
     */
    public void logWarningFailure(String metric, String message, Map<String, Object> details, Throwable error) {
        try (var scope = withContext(Map.of(MDC_METRIC, metric))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", WarningEventType.CHECK_FAILED.name());
            logData.put("metric", metric);

            if (details != null) {
                logData.putAll(details);
            }
            log.error("{} | data={}", message, formatLogData(logData), error);
        }
    }

    /**
     * Log a detection rule event.
     */
    public void logRuleEvent(String ruleId, RuleEventType eventType,
                             String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_RULE_ID, ruleId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("ruleId", ruleId);

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case RULE_CREATED, RULE_ENABLED, RULE_DISABLED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log the outcome of a scheduled pass.
     */
    public void logPassEvent(String loop, String passId, PassEventType eventType,
                             String message, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        logData.put("loop", loop);
        logData.put("passId", passId);

        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case PASS_SKIPPED, PASS_FAILED ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);

        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > 5000) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Execute a timed operation with logging.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            logPerformance(operation, Duration.between(start, Instant.now()), success, null);
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Set pass identifiers in MDC.
     */
    public MDCScope withPass(String loop, String passId) {
        MDC.put(MDC_LOOP, loop);
        MDC.put(MDC_PASS_ID, passId);
        return new MDCScope(MDC_LOOP, MDC_PASS_ID);
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum DetectionEventType {
        DETECTION_STARTED, INSUFFICIENT_DATA, GATEWAY_FAILURE, DETECTOR_FAILED,
        ANOMALY_DETECTED, DETECTION_COMPLETED, ANOMALY_ACKNOWLEDGED, ANOMALY_RESOLVED
    }

    public enum WarningEventType {
        CHECK_FAILED, WARNING_RAISED,
        ACKNOWLEDGED, RESOLVED, DISMISSED
    }

    public enum RuleEventType {
        RULE_CREATED, RULE_ENABLED, RULE_DISABLED, RULE_TRIGGERED
    }

    public enum PassEventType {
        PASS_STARTED, PASS_COMPLETED, PASS_SKIPPED, PASS_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
