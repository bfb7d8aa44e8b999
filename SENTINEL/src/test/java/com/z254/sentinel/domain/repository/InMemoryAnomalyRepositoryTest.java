package com.z254.sentinel.domain.repository;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyStatus;
import com.z254.sentinel.domain.model.AnomalyDetection.AnomalyType;
import com.z254.sentinel.observability.SentinelMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static com.z254.sentinel.TestSamples.START;
import static com.z254.sentinel.TestSamples.anomaly;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAnomalyRepositoryTest {

    private SimpleMeterRegistry meterRegistry;
    private InMemoryAnomalyRepository repository;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        repository = new InMemoryAnomalyRepository(new SentinelProperties(), new SentinelMetrics(meterRegistry));
    }

    @Test
    void keepsFirstAnomalyPerMetricTypeAndHour() {
        AnomalyDetection first = anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofMinutes(5)));
        AnomalyDetection sameHour = anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofMinutes(40)));
        AnomalyDetection otherType = anomaly("cpu", AnomalyType.DROP, START.plus(Duration.ofMinutes(40)));

        List<AnomalyDetection> stored = repository.saveAll(List.of(first, sameHour, otherType));

        assertThat(stored).extracting(AnomalyDetection::getId)
                .containsExactly(first.getId(), otherType.getId());
        assertThat(repository.size()).isEqualTo(2);
    }

    @Test
    void savingTheSameDetectionsTwiceStoresThemOnce() {
        List<AnomalyDetection> firstPass = List.of(
                anomaly("cpu", AnomalyType.SPIKE, START),
                anomaly("cpu", AnomalyType.OUTLIER, START.plus(Duration.ofHours(2))));
        List<AnomalyDetection> secondPass = firstPass.stream()
                .map(a -> a.toBuilder().id("rerun-" + a.getId()).build())
                .toList();

        List<AnomalyDetection> stored = repository.saveAll(firstPass);
        List<AnomalyDetection> restored = repository.saveAll(secondPass);

        assertThat(repository.size()).isEqualTo(2);
        assertThat(restored).extracting(AnomalyDetection::getId)
                .containsExactlyElementsOf(stored.stream().map(AnomalyDetection::getId).toList());
    }

    @Test
    void evictsOldestBeyondCapacity() {
        List<AnomalyDetection> anomalies = new ArrayList<>();
        IntStream.range(0, 1050).forEach(i ->
                anomalies.add(anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofHours(i)))));

        // insert newest first so that eviction must follow detection time, not insertion order
        List<AnomalyDetection> reversed = new ArrayList<>(anomalies);
        Collections.reverse(reversed);
        List<AnomalyDetection> stored = repository.saveAll(reversed);

        assertThat(repository.size()).isEqualTo(1000);
        assertThat(stored).hasSize(1000);
        anomalies.subList(0, 50).forEach(evicted ->
                assertThat(repository.findById(evicted.getId())).isEmpty());
        anomalies.subList(50, 1050).forEach(kept ->
                assertThat(repository.findById(kept.getId())).isPresent());
        assertThat(meterRegistry.get("sentinel.anomalies.evicted").counter().count()).isEqualTo(50.0);
        assertThat(meterRegistry.get("sentinel.anomalies.stored").gauge().value()).isEqualTo(1000.0);
    }

    @Test
    void capAppliesAcrossSaves() {
        SentinelProperties properties = new SentinelProperties();
        properties.getDetection().setRetentionCapacity(1);
        InMemoryAnomalyRepository small = new InMemoryAnomalyRepository(properties,
                new SentinelMetrics(new SimpleMeterRegistry()));

        AnomalyDetection old = anomaly("cpu", AnomalyType.SPIKE, START);
        small.saveAll(List.of(old));
        small.saveAll(List.of(anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofHours(5)))));
        AnomalyDetection again = anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofHours(9)));
        small.saveAll(List.of(again));

        assertThat(small.findAll()).extracting(AnomalyDetection::getId).containsExactly(again.getId());
    }

    @Test
    void returnsCopiesThatDoNotLeakMutations() {
        AnomalyDetection saved = repository.saveAll(List.of(anomaly("cpu", AnomalyType.SPIKE, START))).get(0);

        saved.setStatus(AnomalyStatus.RESOLVED);
        saved.getRuleIds().add("leaked");

        AnomalyDetection reloaded = repository.findById(saved.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(AnomalyStatus.NEW);
        assertThat(reloaded.getRuleIds()).isEmpty();
    }

    @Test
    void updatesStoredAnomalyInPlace() {
        AnomalyDetection saved = repository.saveAll(List.of(anomaly("cpu", AnomalyType.SPIKE, START))).get(0);

        AnomalyDetection updated = repository.update(saved.getId(), a -> a.acknowledge("alice")).orElseThrow();

        assertThat(updated.getStatus()).isEqualTo(AnomalyStatus.INVESTIGATING);
        assertThat(repository.findById(saved.getId()).orElseThrow().getAssignedTo()).isEqualTo("alice");
        assertThat(repository.update("missing", a -> a.acknowledge("alice"))).isEmpty();
    }

    @Test
    void listsOldestFirst() {
        AnomalyDetection later = anomaly("cpu", AnomalyType.SPIKE, START.plus(Duration.ofHours(3)));
        AnomalyDetection earlier = anomaly("mem", AnomalyType.DROP, START);
        repository.saveAll(List.of(later, earlier));

        assertThat(repository.findAll()).extracting(AnomalyDetection::getId)
                .containsExactly(earlier.getId(), later.getId());
    }
}
