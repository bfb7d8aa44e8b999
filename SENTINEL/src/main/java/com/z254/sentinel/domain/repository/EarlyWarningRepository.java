package com.z254.sentinel.domain.repository;

import com.z254.sentinel.domain.model.EarlyWarning;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Repository abstraction for early warnings.
 */
public interface EarlyWarningRepository {

    /**
     * Store warnings, then apply the retention cap.
     *
     * @return copies of the warnings that survived eviction
     */
    List<EarlyWarning> saveAll(List<EarlyWarning> warnings);

    Optional<EarlyWarning> findById(String id);

    List<EarlyWarning> findAll();

    /**
     * Apply a mutation to a stored warning atomically.
     *
     * @return a copy of the updated warning, or empty when the ID is unknown
     */
    Optional<EarlyWarning> update(String id, Consumer<EarlyWarning> mutation);

    int size();

    int capacity();
}
