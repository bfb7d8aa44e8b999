package com.z254.sentinel.domain.repository;

import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.EarlyWarning;
import com.z254.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory early-warning store capped to the configured retention.
 */
@Slf4j
@Repository
public class InMemoryEarlyWarningRepository implements EarlyWarningRepository {

    private final RetentionBoundedStore<EarlyWarning> store;
    private final SentinelMetrics metrics;

    public InMemoryEarlyWarningRepository(SentinelProperties sentinelProperties, SentinelMetrics metrics) {
        this.metrics = metrics;
        this.store = new RetentionBoundedStore<>(
                sentinelProperties.getWarning().getRetentionCapacity(),
                EarlyWarning::getId,
                EarlyWarning::getCreatedAt,
                EarlyWarning::snapshot);
    }

    @Override
    public List<EarlyWarning> saveAll(List<EarlyWarning> warnings) {
        RetentionBoundedStore.InsertResult<EarlyWarning> result = store.insertAll(warnings, null);

        if (result.evicted() > 0) {
            log.debug("Evicted {} oldest warnings to stay within capacity {}",
                    result.evicted(), store.capacity());
            metrics.recordWarningsEvicted(result.evicted());
        }
        metrics.updateStoredWarnings(result.size());
        return result.stored();
    }

    @Override
    public Optional<EarlyWarning> findById(String id) {
        return store.findById(id);
    }

    @Override
    public List<EarlyWarning> findAll() {
        return store.findAll();
    }

    @Override
    public Optional<EarlyWarning> update(String id, Consumer<EarlyWarning> mutation) {
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
