package com.z254.sentinel.scheduler;

import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.domain.service.AnomalyDetectionService;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionSchedulerTest {

    @Mock
    private AnomalyDetectionService detectionService;

    private DetectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new DetectionScheduler(detectionService, new SentinelStructuredLogger());
    }

    @Test
    void detectionLoopRunsPassOverDefaultWindow() {
        when(detectionService.runDetectionPass(isNull())).thenAnswer(invocation -> {
            assertThat(MDC.get(SentinelStructuredLogger.MDC_LOOP)).isEqualTo(AnomalyDetectionService.DETECTION_LOOP);
            assertThat(MDC.get(SentinelStructuredLogger.MDC_PASS_ID)).isNotBlank();
            return List.of();
        });

        scheduler.runDetectionLoop();

        verify(detectionService).runDetectionPass(null);
        assertThat(MDC.get(SentinelStructuredLogger.MDC_PASS_ID)).isNull();
    }

    @Test
    void failedPassDoesNotEscapeTheLoop() {
        when(detectionService.runDetectionPass(isNull())).thenThrow(new IllegalStateException("store corrupted"));

        assertThatCode(scheduler::runDetectionLoop).doesNotThrowAnyException();
        assertThat(MDC.get(SentinelStructuredLogger.MDC_LOOP)).isNull();
    }

    @Test
    void warningLoopGeneratesWarnings() {
        when(detectionService.generateEarlyWarnings(isNull())).thenReturn(List.of(new EarlyWarning()));

        scheduler.runWarningLoop();

        verify(detectionService).generateEarlyWarnings(null);
    }

    @Test
    void failedWarningPassDoesNotEscapeTheLoop() {
        when(detectionService.generateEarlyWarnings(isNull())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(scheduler::runWarningLoop).doesNotThrowAnyException();
    }
}
