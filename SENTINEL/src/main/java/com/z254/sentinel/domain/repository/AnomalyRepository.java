package com.z254.sentinel.domain.repository;

import com.z254.sentinel.domain.model.AnomalyDetection;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Repository abstraction for detected anomalies.
 */
public interface AnomalyRepository {

    /**
     * Store anomalies whose deduplication key is not yet present, then apply the retention cap.
     *
     * @return copies of the stored counterpart of each anomaly: the anomaly itself when it was
     *         inserted, or the one already stored under the same key; evicted entries are omitted
     */
    List<AnomalyDetection> saveAll(List<AnomalyDetection> anomalies);

    /**
     * Look up an anomaly by ID.
     */
    Optional<AnomalyDetection> findById(String id);

    /**
     * Retrieve copies of all retained anomalies.
     */
    List<AnomalyDetection> findAll();

    /**
     * Apply a mutation to a stored anomaly atomically.
     *
     * @return a copy of the updated anomaly, or empty when the ID is unknown
     */
    Optional<AnomalyDetection> update(String id, Consumer<AnomalyDetection> mutation);

    int size();

    int capacity();
}
