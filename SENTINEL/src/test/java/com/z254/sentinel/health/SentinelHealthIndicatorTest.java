package com.z254.sentinel.health;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.repository.InMemoryAnomalyRepository;
import com.z254.sentinel.domain.repository.InMemoryEarlyWarningRepository;
import com.z254.sentinel.observability.SentinelMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SentinelHealthIndicatorTest {

    private SentinelProperties properties;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private SentinelHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        SentinelMetrics metrics = new SentinelMetrics(new SimpleMeterRegistry());
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        healthIndicator = new SentinelHealthIndicator(
                new InMemoryAnomalyRepository(properties, metrics),
                new InMemoryEarlyWarningRepository(properties, metrics),
                circuitBreakerRegistry,
                properties);
    }

    @Test
    void upWhileWithinStartupGrace() {
        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("anomalies.capacity", 1000)
                            .containsEntry("warnings.capacity", 500)
                            .containsEntry("anomalies.stored", 0)
                            .containsEntry("gateway.circuitBreaker", "CLOSED");
                })
                .verifyComplete();
    }

    @Test
    void downWhenDetectionLoopStalled() {
        Instant now = Instant.now();
        healthIndicator.recordDetectionPass(now.minus(Duration.ofHours(1)));
        healthIndicator.recordWarningPass(now);

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsKey("detection.error")
                            .doesNotContainKey("warning.error");
                })
                .verifyComplete();
    }

    @Test
    void stalledLoopsIgnoredWithoutScheduler() {
        properties.getScheduler().setEnabled(false);
        healthIndicator.recordDetectionPass(Instant.now().minus(Duration.ofDays(1)));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UP))
                .verifyComplete();
    }

    @Test
    void reportsOpenCircuit() {
        circuitBreakerRegistry.circuitBreaker("metric-gateway").transitionToOpenState();

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getDetails())
                        .containsEntry("gateway.circuitBreaker", "OPEN"))
                .verifyComplete();
    }
}
