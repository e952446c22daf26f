package io.sentinel.work.internal;

import io.sentinel.work.ProgressReporter;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.event.EventType;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes {@link EventType#WORK_PROGRESS} events for one run.
 *
 * <p>Reports closer together than the throttle interval are dropped, except a report with
 * {@code current >= total}, which always goes out so observers see completion.
 */
class EventProgressReporter implements ProgressReporter {

    static final String MODULE = "work";

    private final EventBus events;
    private final WorkItem item;
    private final String runId;
    private final Clock clock;
    private final long minIntervalMillis;

    private long lastEmitMillis = Long.MIN_VALUE;

    EventProgressReporter(EventBus events, WorkItem item, String runId, Clock clock, Duration throttle) {
        this.events = events;
        this.item = item;
        this.runId = runId;
        this.clock = clock;
        this.minIntervalMillis = throttle.toMillis();
    }

    @Override
    public synchronized void report(int current, int total, String message) {
        long now = clock.millis();
        boolean complete = total > 0 && current >= total;
        if (!complete && lastEmitMillis != Long.MIN_VALUE && now - lastEmitMillis < minIntervalMillis) {
            return;
        }
        lastEmitMillis = now;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("item_id", item.id());
        data.put("work_type", item.workTypeId());
        data.put("subject", item.subject());
        data.put("run_id", runId);
        data.put("current", current);
        data.put("total", total);
        data.put("message", message);
        events.emit(EventType.WORK_PROGRESS, MODULE, data);
    }
}
