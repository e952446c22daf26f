package io.sentinel.work.internal;

import io.sentinel.work.WorkType;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.spi.CompletionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last successful completion per work item.
 *
 * <p>Records live in a concurrent map keyed by item id and are written through to the
 * {@link CompletionStore}. Timestamps only move forward: marking an item with an older timestamp
 * keeps the stored one.
 *
 * <p>A failed store write leaves the in-memory record ahead of the durable one until a later
 * completion of the same item is written; {@link #persistFailureCount()} counts such failures.
 */
public class CompletionTracker {
    private static final Logger log = LoggerFactory.getLogger(CompletionTracker.class);

    private final ConcurrentHashMap<String, Instant> records = new ConcurrentHashMap<>();
    private final CompletionStore store;
    private final AtomicLong persistFailures = new AtomicLong();

    public CompletionTracker(CompletionStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Load persisted records. Called once before the engine starts scheduling.
     */
    public void load() {
        Map<String, Instant> persisted = store.loadAll();
        persisted.forEach((id, at) -> records.merge(id, at, CompletionTracker::later));
        log.info("Completion records loaded count={}", persisted.size());
    }

    public void markCompletedAt(WorkItem item, Instant completedAt) {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");

        String id = item.id();
        records.merge(id, completedAt, CompletionTracker::later);
        try {
            store.saveIfLater(id, completedAt);
        } catch (Exception e) {
            long total = persistFailures.incrementAndGet();
            log.error("completion store write failed; in-memory record is ahead of the store id={} completedAt={} failures={} msg={}",
                    id, completedAt, total, e.getMessage(), e);
        }
    }

    public Optional<Instant> lastCompletion(String itemId) {
        return Optional.ofNullable(records.get(itemId));
    }

    public Optional<Instant> lastCompletion(WorkItem item) {
        return lastCompletion(item.id());
    }

    /**
     * Completion of dependency {@code dependencyId} as seen by an item with {@code subject}: the
     * same-subject record, else the dependency's global record.
     */
    public Optional<Instant> dependencyCompletion(String dependencyId, String subject) {
        Instant same = records.get(WorkItem.idOf(dependencyId, subject));
        if (same != null) {
            return Optional.of(same);
        }
        return Optional.ofNullable(records.get(dependencyId));
    }

    /**
     * Latest completion of the work type across its global record and every subject.
     */
    public Optional<Instant> latestForType(String workTypeId) {
        String prefix = workTypeId + ":";
        Instant latest = records.get(workTypeId);
        for (Map.Entry<String, Instant> e : records.entrySet()) {
            if (e.getKey().startsWith(prefix)) {
                latest = later(latest, e.getValue());
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Whether the scheduled path should run the item again. On-demand types are never due.
     */
    public boolean isDue(WorkType workType, String subject, Instant now) {
        Duration interval = workType.interval();
        if (interval.isZero()) {
            return false;
        }
        Instant last = records.get(WorkItem.idOf(workType.id(), subject));
        if (last == null) {
            return true;
        }
        return Duration.between(last, now).compareTo(interval) >= 0;
    }

    public long persistFailureCount() {
        return persistFailures.get();
    }

    public int size() {
        return records.size();
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
