package com.z254.sentinel.domain.repository;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.AnomalyDetection;
import com.z254.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory anomaly store, deduplicated by anomaly key and capped to the configured retention.
 */
@Slf4j
@Repository
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final RetentionBoundedStore<AnomalyDetection> store;
    private final Duration dedupBucket;
    private final SentinelMetrics metrics;

    public InMemoryAnomalyRepository(SentinelProperties sentinelProperties, SentinelMetrics metrics) {
        this.dedupBucket = sentinelProperties.getDetection().getDedupBucket();
        this.metrics = metrics;
        this.store = new RetentionBoundedStore<>(
                sentinelProperties.getDetection().getRetentionCapacity(),
                AnomalyDetection::getId,
                AnomalyDetection::getDetectedAt,
                AnomalyDetection::snapshot);
    }

    @Override
    public List<AnomalyDetection> saveAll(List<AnomalyDetection> anomalies) {
        RetentionBoundedStore.InsertResult<AnomalyDetection> result =
                store.insertAll(anomalies, anomaly -> anomaly.dedupKey(dedupBucket));

        if (result.evicted() > 0) {
            log.debug("Evicted {} oldest anomalies to stay within capacity {}",
                    result.evicted(), store.capacity());
            metrics.recordAnomaliesEvicted(result.evicted());
        }
        metrics.updateStoredAnomalies(result.size());
        return result.stored();
    }

    @Override
    public Optional<AnomalyDetection> findById(String id) {
        return store.findById(id);
    }

    @Override
    public List<AnomalyDetection> findAll() {
        return store.findAll();
    }

    @Override
    public Optional<AnomalyDetection> update(String id, Consumer<AnomalyDetection> mutation) {
        return store.update(id, mutation);
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public int capacity() {
        return store.capacity();
    }
}
