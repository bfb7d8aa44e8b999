package com.z254.sentinel.domain.model;

import com.z254.sentinel.domain.model.EarlyWarning.WarningStatus;
import com.z254.sentinel.domain.model.EarlyWarning.WarningType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EarlyWarningTest {

    @Test
    void acknowledgedWarningCanStillBeResolved() {
        EarlyWarning warning = warning();

        assertThat(warning.acknowledge("ops")).isTrue();
        assertThat(warning.acknowledge("other")).isFalse();
        assertThat(warning.resolve()).isTrue();

        assertThat(warning.getStatus()).isEqualTo(WarningStatus.RESOLVED);
        assertThat(warning.getAcknowledgedBy()).isEqualTo("ops");
        assertThat(warning.getResolvedAt()).isNotNull();
    }

    @Test
    void closedWarningsStayClosed() {
        EarlyWarning dismissed = warning();
        dismissed.dismiss();
        EarlyWarning resolved = warning();
        resolved.resolve();

        assertThat(dismissed.acknowledge("ops")).isFalse();
        assertThat(dismissed.resolve()).isFalse();
        assertThat(resolved.dismiss()).isFalse();
        assertThat(resolved.acknowledge("ops")).isFalse();

        assertThat(dismissed.getStatus()).isEqualTo(WarningStatus.DISMISSED);
        assertThat(dismissed.getAcknowledgedAt()).isNull();
        assertThat(resolved.getStatus()).isEqualTo(WarningStatus.RESOLVED);
        assertThat(resolved.getDismissedAt()).isNull();
    }

    private EarlyWarning warning() {
        return EarlyWarning.builder()
                .id("w-1")
                .type(WarningType.THRESHOLD_BREACH)
                .severity(Severity.HIGH)
                .metric("compute")
                .createdAt(Instant.parse("2024-03-04T00:00:00Z"))
                .build();
    }
}
