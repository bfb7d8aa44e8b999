package com.z254.sentinel.detection;

import com.z254.sentinel.client.MetricGateway;
import com.z254.sentinel.client.MetricGatewayException;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.MetricSample;
import com.z254.sentinel.domain.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.z254.sentinel.TestSamples.START;
import static com.z254.sentinel.TestSamples.constant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricWindowManagerTest {

    private static final Instant RECENT_START = START.plus(Duration.ofDays(1));
    private static final TimeRange RECENT = new TimeRange(RECENT_START, RECENT_START.plus(Duration.ofDays(1)));

    @Mock
    private MetricGateway metricGateway;

    private SentinelProperties properties;
    private MetricWindowManager windowManager;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        properties.getGateway().setTimeout(Duration.ofMillis(100));
        windowManager = new MetricWindowManager(metricGateway, properties);
    }

    @Test
    void loadsRecentAndPrecedingBaseline() {
        TimeRange baselineRange = RECENT.preceding();
        when(metricGateway.getRecentSamples("compute", RECENT))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 24, 0.5)));
        when(metricGateway.getRecentSamples("compute", baselineRange))
                .thenReturn(Flux.fromIterable(constant(START, 24, 0.4)));

        MetricWindows windows = windowManager.loadWindows("compute", RECENT);

        assertThat(windows.recent()).hasSize(24);
        assertThat(windows.baseline()).hasSize(24);
        assertThat(windows.baselineRange()).isEqualTo(new TimeRange(START, RECENT_START));
        assertThat(windows.hasEnoughData(10, 20)).isTrue();
    }

    @Test
    void skipsBaselineWhenRecentWindowIsTooShort() {
        when(metricGateway.getRecentSamples("compute", RECENT))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 5, 0.5)));

        MetricWindows windows = windowManager.loadWindows("compute", RECENT);

        assertThat(windows.baseline()).isEmpty();
        assertThat(windows.hasEnoughData(10, 20)).isFalse();
        verify(metricGateway, never()).getRecentSamples("compute", RECENT.preceding());
    }

    @Test
    void sortsSamplesByTimestamp() {
        List<MetricSample> samples = constant(RECENT_START, 3, 1.0);
        when(metricGateway.getRecentSamples("compute", RECENT))
                .thenReturn(Flux.just(samples.get(2), samples.get(0), samples.get(1)));

        assertThat(windowManager.fetchSamples("compute", RECENT)).containsExactlyElementsOf(samples);
    }

    @Test
    void wrapsGatewayErrors() {
        when(metricGateway.getRecentSamples("storage", RECENT))
                .thenReturn(Flux.error(new IOException("connection reset")));

        assertThatThrownBy(() -> windowManager.fetchSamples("storage", RECENT))
                .isInstanceOf(MetricGatewayException.class)
                .hasCauseInstanceOf(IOException.class)
                .satisfies(error -> assertThat(((MetricGatewayException) error).getMetric()).isEqualTo("storage"));
    }

    @Test
    void wrapsExceptionsThrownByTheGatewayCall() {
        when(metricGateway.getRecentSamples("storage", RECENT))
                .thenThrow(new UncheckedIOException(new IOException("socket reset")));

        assertThatThrownBy(() -> windowManager.fetchSamples("storage", RECENT))
                .isInstanceOf(MetricGatewayException.class)
                .hasCauseInstanceOf(UncheckedIOException.class);
    }

    @Test
    void timesOutSlowGateway() {
        when(metricGateway.getRecentSamples("storage", RECENT)).thenReturn(Flux.never());

        assertThatThrownBy(() -> windowManager.fetchSamples("storage", RECENT))
                .isInstanceOf(MetricGatewayException.class);
    }

    @Test
    void reusesCachedBaselineWithinTheSameHour() {
        TimeRange shifted = new TimeRange(RECENT.start().plus(Duration.ofMinutes(10)),
                RECENT.end().plus(Duration.ofMinutes(10)));
        when(metricGateway.getRecentSamples(eq("compute"), eq(RECENT)))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 24, 0.5)));
        when(metricGateway.getRecentSamples(eq("compute"), eq(shifted)))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 24, 0.5)));
        when(metricGateway.getRecentSamples(eq("compute"), eq(RECENT.preceding())))
                .thenReturn(Flux.fromIterable(constant(START, 24, 0.4)));

        windowManager.loadWindows("compute", RECENT);
        MetricWindows second = windowManager.loadWindows("compute", shifted);

        assertThat(second.baseline()).hasSize(24);
        assertThat(windowManager.cachedBaselineCount()).isEqualTo(1);
        verify(metricGateway, times(1)).getRecentSamples("compute", RECENT.preceding());
        verify(metricGateway, never()).getRecentSamples("compute", shifted.preceding());
    }

    @Test
    void invalidatedBaselineIsFetchedAgain() {
        when(metricGateway.getRecentSamples("compute", RECENT))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 24, 0.5)));
        when(metricGateway.getRecentSamples("compute", RECENT.preceding()))
                .thenReturn(Flux.fromIterable(constant(START, 24, 0.4)));

        windowManager.loadWindows("compute", RECENT);
        windowManager.invalidateBaselines();
        windowManager.loadWindows("compute", RECENT);

        verify(metricGateway, times(2)).getRecentSamples("compute", RECENT.preceding());
    }

    @Test
    void bypassesCacheWhenDisabled() {
        properties.getBaselineCache().setEnabled(false);
        when(metricGateway.getRecentSamples("compute", RECENT))
                .thenReturn(Flux.fromIterable(constant(RECENT_START, 24, 0.5)));
        when(metricGateway.getRecentSamples("compute", RECENT.preceding()))
                .thenReturn(Flux.fromIterable(constant(START, 24, 0.4)));

        windowManager.loadWindows("compute", RECENT);
        windowManager.loadWindows("compute", RECENT);

        assertThat(windowManager.cachedBaselineCount()).isZero();
        verify(metricGateway, times(2)).getRecentSamples("compute", RECENT.preceding());
    }
}
