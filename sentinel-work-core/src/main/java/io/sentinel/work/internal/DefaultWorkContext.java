package io.sentinel.work.internal;

import io.sentinel.work.WorkContext;
import io.sentinel.work.core.WorkItem;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

final class DefaultWorkContext implements WorkContext {

    private final WorkItem item;
    private final Map<String, Object> payload;
    private final Instant deadline;
    private final Clock clock;

    private volatile boolean cancelled;

    DefaultWorkContext(WorkItem item, Map<String, Object> payload, Instant deadline, Clock clock) {
        this.item = item;
        this.payload = payload == null ? Map.of() : payload;
        this.deadline = deadline;
        this.clock = clock;
    }

    @Override
    public WorkItem item() {
        return item;
    }

    @Override
    public Map<String, Object> payload() {
        return payload;
    }

    @Override
    public Instant deadline() {
        return deadline;
    }

    @Override
    public boolean isCancelled() {
        return cancelled || !clock.instant().isBefore(deadline);
    }

    void cancel() {
        cancelled = true;
    }
}
