package io.sentinel.work.spi;

import java.time.Instant;
import java.util.Map;

/**
 * Durable storage of last successful completion per work item id.
 */
public interface CompletionStore {

    /**
     * Store {@code completedAt} for the item unless a later timestamp is already stored.
     */
    void saveIfLater(String itemId, Instant completedAt);

    /**
     * Every stored record, keyed by item id. Called once at startup.
     */
    Map<String, Instant> loadAll();
}
