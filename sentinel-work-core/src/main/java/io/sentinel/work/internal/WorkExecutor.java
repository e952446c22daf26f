package io.sentinel.work.internal;

import io.sentinel.work.WorkType;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded worker pool shared by the schedule and the job queue.
 *
 * <p>At most one run per {@link WorkItem} is in flight at any time, whichever path submitted it.
 * Successful runs record their completion before the item leaves the in-flight set, so the next
 * scheduling pass never sees an item that is neither running nor completed.
 */
public class WorkExecutor {
    private static final Logger log = LoggerFactory.getLogger(WorkExecutor.class);

    static final String SOURCE_SCHEDULE = "schedule";
    static final String SOURCE_QUEUE = "queue";

    private final int maxConcurrency;
    private final CompletionTracker tracker;
    private final EventBus events;
    private final Clock clock;
    private final Duration executionTimeout;
    private final Duration progressThrottle;

    private final Semaphore permits;
    private final ConcurrentHashMap<String, Run> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger threadSeq = new AtomicInteger();

    private volatile Runnable onSettled = () -> {
    };

    private ExecutorService workerPool;

    private static final class Run {
        private final DefaultWorkContext context;
        private final String jobId;
        private volatile boolean abandoned;

        private Run(DefaultWorkContext context, String jobId) {
            this.context = context;
            this.jobId = jobId;
        }
    }

    public WorkExecutor(int maxConcurrency,
                        CompletionTracker tracker,
                        EventBus events,
                        Clock clock,
                        Duration executionTimeout,
                        Duration progressThrottle) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.maxConcurrency = maxConcurrency;
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executionTimeout = Objects.requireNonNull(executionTimeout, "executionTimeout must not be null");
        this.progressThrottle = Objects.requireNonNull(progressThrottle, "progressThrottle must not be null");
        this.permits = new Semaphore(maxConcurrency);
    }

    /**
     * Called on the worker thread after every run, abandoned or not.
     */
    public void onSettled(Runnable listener) {
        this.onSettled = Objects.requireNonNull(listener, "listener must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("work.worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Cancel every in-flight context, wait up to {@code grace} for runs to return, then abandon
     * the rest. Abandoned runs record nothing when they eventually finish.
     */
    public void stop(Duration grace) {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        inFlight.values().forEach(r -> r.context.cancel());
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                abandonRemaining();
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonRemaining();
            workerPool.shutdownNow();
        } finally {
            workerPool = null;
        }
    }

    private void abandonRemaining() {
        inFlight.forEach((id, run) -> {
            run.abandoned = true;
            log.warn("work item abandoned on shutdown id={}", id);
        });
    }

    public boolean isRunning() {
        return started.get();
    }

    public boolean isInFlight(String itemId) {
        return inFlight.containsKey(itemId);
    }

    /**
     * Whether {@code itemId} is currently running on behalf of queued job {@code jobId}.
     */
    public boolean isRunningJob(String itemId, String jobId) {
        Run run = inFlight.get(itemId);
        return run != null && jobId != null && jobId.equals(run.jobId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int availableCapacity() {
        return started.get() ? permits.availablePermits() : 0;
    }

    /**
     * Submit one run. Returns false, without side effects, when the pool is full, the item is
     * already in flight or the executor is stopped.
     *
     * @param onResult invoked on the worker thread with the outcome, unless the run was abandoned
     */
    boolean submit(WorkType workType,
                   WorkItem item,
                   Map<String, Object> payload,
                   String source,
                   String jobId,
                   Consumer<ExecutionResult> onResult) {
        if (!started.get() || !permits.tryAcquire()) {
            return false;
        }

        Instant now = clock.instant();
        Run run = new Run(new DefaultWorkContext(item, payload, now.plus(executionTimeout), clock), jobId);
        if (inFlight.putIfAbsent(item.id(), run) != null) {
            permits.release();
            return false;
        }

        try {
            workerPool.submit(() -> execute(workType, item, run, source, jobId, onResult));
        } catch (RuntimeException e) {
            inFlight.remove(item.id(), run);
            permits.release();
            throw e;
        }
        return true;
    }

    private void execute(WorkType workType,
                         WorkItem item,
                         Run run,
                         String source,
                         String jobId,
                         Consumer<ExecutionResult> onResult) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        ExecutionResult result = null;
        try {
            log.debug("work item started id={} source={} runId={}", item.id(), source, runId);
            events.emit(EventType.WORK_STARTED, EventProgressReporter.MODULE, eventData(item, runId, source, jobId));

            Throwable error = null;
            try {
                workType.execute(run.context, item.subject(),
                        new EventProgressReporter(events, item, runId, clock, progressThrottle));
            } catch (Exception e) {
                error = e;
            }
            result = new ExecutionResult(item, runId, startedAt, clock.instant(), error);

            if (run.abandoned) {
                log.warn("discarding result of abandoned work item id={} runId={}", item.id(), runId);
                return;
            }
            record(result, source, jobId);
            if (onResult != null) {
                onResult.accept(result);
            }
        } catch (Exception e) {
            log.error("work item bookkeeping failed id={} runId={} msg={}", item.id(), runId, e.getMessage(), e);
        } finally {
            inFlight.remove(item.id(), run);
            permits.release();
            onSettled.run();
        }
    }

    private void record(ExecutionResult result, String source, String jobId) {
        WorkItem item = result.item();
        Map<String, Object> data = eventData(item, result.runId(), source, jobId);
        data.put("duration_ms", Duration.between(result.startedAt(), result.finishedAt()).toMillis());

        if (result.succeeded()) {
            tracker.markCompletedAt(item, result.finishedAt());
            log.debug("work item succeeded id={} source={} runId={}", item.id(), source, result.runId());
            events.emit(EventType.WORK_COMPLETED, EventProgressReporter.MODULE, data);
        } else {
            log.error("work item failed id={} source={} runId={} msg={}",
                    item.id(), source, result.runId(), result.errorMessage(), result.error());
            data.put("error", result.errorMessage());
            events.emit(EventType.WORK_FAILED, EventProgressReporter.MODULE, data);
        }
    }

    private static Map<String, Object> eventData(WorkItem item, String runId, String source, String jobId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("item_id", item.id());
        data.put("work_type", item.workTypeId());
        data.put("subject", item.subject());
        data.put("run_id", runId);
        data.put("source", source);
        if (jobId != null) {
            data.put("job_id", jobId);
        }
        return data;
    }
}
