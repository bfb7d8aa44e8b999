package com.z254.sentinel.warning;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.EarlyWarning.WarningType;
import com.z254.sentinel.domain.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.z254.sentinel.TestSamples.START;
import static com.z254.sentinel.TestSamples.hourly;
import static org.assertj.core.api.Assertions.assertThat;

class CapacityWarningCheckTest {

    private CapacityWarningCheck check;

    @BeforeEach
    void setUp() {
        check = new CapacityWarningCheck(new SentinelProperties());
    }

    @Test
    void nearlyExhaustedResourceIsCritical() {
        assertThat(check.evaluate("storage", hourly(START, 0.9, 0.95))).hasValueSatisfying(w -> {
            assertThat(w.getType()).isEqualTo(WarningType.CAPACITY_WARNING);
            assertThat(w.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(w.getThreshold()).isEqualTo(0.8);
            assertThat(w.getDescription()).isEqualTo("storage utilization is at 95%");
            assertThat(w.getContext()).containsEntry("resource", "storage").containsEntry("utilization", 0.95);
            assertThat(w.getTimeToBreach()).isPositive().isFinite();
        });
    }

    @Test
    void highUtilizationIsHigh() {
        assertThat(check.evaluate("compute", hourly(START, 0.85, 0.85)))
                .hasValueSatisfying(w -> {
                    assertThat(w.getSeverity()).isEqualTo(Severity.HIGH);
                    assertThat(w.getTimeToBreach()).isEqualTo(Double.POSITIVE_INFINITY);
                });
    }

    @Test
    void normalUtilizationDoesNotWarn() {
        assertThat(check.evaluate("compute", hourly(START, 0.5, 0.8))).isEmpty();
    }
}
