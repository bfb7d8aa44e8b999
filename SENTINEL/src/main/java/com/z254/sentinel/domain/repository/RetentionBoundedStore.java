package com.z254.sentinel.domain.repository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Capacity-bounded in-memory store that evicts the oldest entries first.
 * <p>
 * Entries are indexed by ID, optionally by a deduplication key, and ordered by their
 * timestamp for eviction. Every mutation happens under a single lock; reads hand out copies
 * produced by the snapshot function so callers never observe or cause a partial update.
 *
 * @param <T> entry type
 */
class RetentionBoundedStore<T> {

    private final int capacity;
    private final Function<T, String> idFunction;
    private final Function<T, Instant> timestampFunction;
    private final UnaryOperator<T> snapshotFunction;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, T> byId = new HashMap<>();
    private final Map<String, String> idByKey = new HashMap<>();
    private final Map<String, String> keyById = new HashMap<>();
    private final NavigableSet<T> byAge;

    RetentionBoundedStore(int capacity,
                          Function<T, String> idFunction,
                          Function<T, Instant> timestampFunction,
                          UnaryOperator<T> snapshotFunction) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.idFunction = idFunction;
        this.timestampFunction = timestampFunction;
        this.snapshotFunction = snapshotFunction;
        this.byAge = new TreeSet<>(Comparator.comparing(timestampFunction)
                .thenComparing(idFunction));
    }

    /**
     * Insert entries, skipping those whose key is already stored or repeated within the batch.
     * A {@code null} key function disables deduplication.
     * <p>
     * The result lists, in input order, the stored counterpart of every entry: the entry itself
     * when it was inserted, or the entry already stored under the same key. Entries evicted
     * by the same call are left out.
     */
    InsertResult<T> insertAll(List<T> entries, Function<T, String> keyFunction) {
        lock.lock();
        try {
            List<String> storedIds = new ArrayList<>();
            int inserted = 0;
            for (T entry : entries) {
                String id = idFunction.apply(entry);
                if (byId.containsKey(id)) {
                    storedIds.add(id);
                    continue;
                }
                if (keyFunction != null) {
                    String key = keyFunction.apply(entry);
                    String existingId = idByKey.get(key);
                    if (existingId != null) {
                        storedIds.add(existingId);
                        continue;
                    }
                    idByKey.put(key, id);
                    keyById.put(id, key);
                }
                byId.put(id, entry);
                byAge.add(entry);
                storedIds.add(id);
                inserted++;
            }

            int evicted = evictOverflow();

            List<T> stored = storedIds.stream()
                    .distinct()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .map(snapshotFunction)
                    .toList();
            return new InsertResult<>(stored, inserted, evicted, byId.size());
        } finally {
            lock.unlock();
        }
    }

    Optional<T> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(id)).map(snapshotFunction);
        } finally {
            lock.unlock();
        }
    }

    List<T> findAll() {
        lock.lock();
        try {
            return byAge.stream().map(snapshotFunction).toList();
        } finally {
            lock.unlock();
        }
    }

    Optional<T> update(String id, Consumer<T> mutation) {
        lock.lock();
        try {
            T entry = byId.get(id);
            if (entry == null) {
                return Optional.empty();
            }
            mutation.accept(entry);
            return Optional.of(snapshotFunction.apply(entry));
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return byId.size();
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        return capacity;
    }

    private int evictOverflow() {
        int evicted = 0;
        while (byId.size() > capacity) {
            T oldest = byAge.pollFirst();
            if (oldest == null) {
                break;
            }
            String id = idFunction.apply(oldest);
            byId.remove(id);
            String key = keyById.remove(id);
            if (key != null) {
                idByKey.remove(key);
            }
            evicted++;
        }
        return evicted;
    }

    record InsertResult<T>(List<T> stored, int inserted, int evicted, int size) {
    }
}
