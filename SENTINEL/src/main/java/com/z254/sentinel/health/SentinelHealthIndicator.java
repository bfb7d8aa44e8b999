package com.z254.sentinel.health;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.repository.AnomalyRepository;
import com.z254.sentinel.domain.repository.EarlyWarningRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for SENTINEL service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Anomaly and warning store usage</li>
 *     <li>Time of the last completed detection and warning passes</li>
 *     <li>Metric gateway circuit breaker state</li>
 * </ul>
 * A loop that has not completed a pass for three of its intervals marks the service down.
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    static final String GATEWAY_CIRCUIT_BREAKER = "metric-gateway";

    private final AnomalyRepository anomalyRepository;
    private final EarlyWarningRepository warningRepository;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final SentinelProperties sentinelProperties;
    private final Instant startedAt = Instant.now();

    private final AtomicReference<Instant> lastDetectionPass = new AtomicReference<>();
    private final AtomicReference<Instant> lastWarningPass = new AtomicReference<>();

    public SentinelHealthIndicator(AnomalyRepository anomalyRepository,
                                   EarlyWarningRepository warningRepository,
                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                   SentinelProperties sentinelProperties) {
        this.anomalyRepository = anomalyRepository;
        this.warningRepository = warningRepository;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    public void recordDetectionPass(Instant completedAt) {
        lastDetectionPass.set(completedAt);
    }

    public void recordWarningPass(Instant completedAt) {
        lastWarningPass.set(completedAt);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        details.put("anomalies.stored", anomalyRepository.size());
        details.put("anomalies.capacity", anomalyRepository.capacity());
        details.put("warnings.stored", warningRepository.size());
        details.put("warnings.capacity", warningRepository.capacity());

        details.put("detection.lastPass", String.valueOf(lastDetectionPass.get()));
        details.put("warning.lastPass", String.valueOf(lastWarningPass.get()));

        if (sentinelProperties.getScheduler().isEnabled()) {
            Instant now = Instant.now();
            if (isStalled(lastDetectionPass.get(), sentinelProperties.getDetection().getInterval(), now)) {
                healthy = false;
                details.put("detection.error", "No detection pass completed recently");
            }
            if (isStalled(lastWarningPass.get(), sentinelProperties.getWarning().getInterval(), now)) {
                healthy = false;
                details.put("warning.error", "No warning pass completed recently");
            }
        }

        try {
            CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(GATEWAY_CIRCUIT_BREAKER);
            details.put("gateway.circuitBreaker", circuitBreaker.getState().name());
        } catch (RuntimeException e) {
            details.put("gateway.circuitBreaker", "UNKNOWN");
            log.warn("Failed to read metric gateway circuit breaker state", e);
        }

        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }

    private boolean isStalled(Instant lastPass, Duration interval, Instant now) {
        Instant reference = lastPass != null ? lastPass : startedAt;
        return Duration.between(reference, now).compareTo(interval.multipliedBy(3)) > 0;
    }
}
