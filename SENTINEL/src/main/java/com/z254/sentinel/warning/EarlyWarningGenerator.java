package com.z254.sentinel.warning;

import com.z254.sentinel.client.MetricGatewayException;
import com.z254.sentinel.detection.MetricWindowManager;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.WarningEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Runs every {@link WarningCheck} over its metrics for one warning pass.
 * <p>
 * Samples are fetched once per metric and pass and shared by the checks inspecting it.
 * A gateway failure skips that metric for every check; a failing check skips only that
 * check for that metric. Neither aborts the pass.
 */
@Slf4j
@Component
public class EarlyWarningGenerator {

    private final List<WarningCheck> checks;
    private final MetricWindowManager windowManager;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;

    public EarlyWarningGenerator(List<WarningCheck> checks,
                                 MetricWindowManager windowManager,
                                 SentinelMetrics metrics,
                                 SentinelStructuredLogger structuredLogger) {
        this.checks = checks;
        this.windowManager = windowManager;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Evaluate all checks on samples from {@code range}.
     *
     * @return the warnings raised in this pass, in check order
     */
    public List<EarlyWarning> generate(TimeRange range) {
        Map<String, List<MetricSample>> samplesByMetric = new HashMap<>();
        Set<String> failedMetrics = new HashSet<>();
        List<EarlyWarning> warnings = new ArrayList<>();

        for (WarningCheck check : checks) {
            for (String metric : check.metrics()) {
                if (failedMetrics.contains(metric)) {
                    continue;
                }

                List<MetricSample> samples;
                try {
                    samples = samplesByMetric.computeIfAbsent(metric,
                            m -> windowManager.fetchSamples(m, range));
                } catch (MetricGatewayException e) {
                    failedMetrics.add(metric);
                    metrics.recordGatewayFailure();
                    structuredLogger.logWarningEvent(metric, WarningEventType.CHECK_FAILED,
                            "Skipping metric after gateway failure",
                            Map.of("error", String.valueOf(e.getMessage())));
                    continue;
                } catch (RuntimeException e) {
                    failedMetrics.add(metric);
                    metrics.recordCheckFailure();
                    structuredLogger.logWarningFailure(metric, "Skipping metric after fetch failure",
                            Map.of("check", check.type().name()), e);
                    continue;
                }

                if (samples.isEmpty()) {
                    continue;
                }

                try {
                    check.evaluate(metric, samples).ifPresent(warning -> {
                        warnings.add(warning);
                        metrics.recordWarningRaised(warning.getType());
                        structuredLogger.logWarningEvent(metric, WarningEventType.WARNING_RAISED,
                                warning.getTitle(),
                                Map.of("type", warning.getType().name(),
                                        "severity", warning.getSeverity().name(),
                                        "timeToBreach", warning.getTimeToBreach()));
                    });
                } catch (RuntimeException e) {
                    metrics.recordCheckFailure();
                    structuredLogger.logWarningFailure(metric, "Warning check failed",
                            Map.of("check", check.type().name()), e);
                }
            }
        }

        log.debug("Warning pass over {} metrics raised {} warnings ({} metrics failed)",
                samplesByMetric.size() + failedMetrics.size(), warnings.size(), failedMetrics.size());
        return warnings;
    }
}
