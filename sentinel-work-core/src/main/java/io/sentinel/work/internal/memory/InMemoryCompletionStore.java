package io.sentinel.work.internal.memory;

import io.sentinel.work.spi.CompletionStore;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link CompletionStore}; records are lost with the process.
 */
public class InMemoryCompletionStore implements CompletionStore {

    private final ConcurrentHashMap<String, Instant> records = new ConcurrentHashMap<>();

    @Override
    public void saveIfLater(String itemId, Instant completedAt) {
        records.merge(itemId, completedAt, (a, b) -> a.isAfter(b) ? a : b);
    }

    @Override
    public Map<String, Instant> loadAll() {
        return Map.copyOf(records);
    }
}
