package io.sentinel.work.internal;

import io.sentinel.work.WorkType;
import io.sentinel.work.config.WorkProperties;
import io.sentinel.work.core.DependencyNotMetException;
import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobHistoryEntry;
import io.sentinel.work.core.JobRequest;
import io.sentinel.work.core.JobStatus;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.event.EventType;
import io.sentinel.work.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manual path: persisted jobs with retries.
 *
 * <p>A poller thread claims due jobs from the {@link JobStore}, never more than the worker pool can
 * take, and runs them through the shared {@link WorkExecutor}. Interval and market timing are
 * bypassed; every dependency must have completed at least once.
 *
 * <p>A failed attempt is retried while {@code retries < maxRetries}, after
 * {@code retryBaseDelay * 2^(attempt-1)} capped at {@code retryMaxDelay}. A job with
 * {@code maxRetries = N} therefore runs at most {@code N + 1} times before turning FAILED.
 */
public class DefaultJobQueue {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobQueue.class);

    static final String MODULE = "queue";

    private final WorkTypeRegistry registry;
    private final JobStore jobStore;
    private final CompletionTracker tracker;
    private final WorkExecutor executor;
    private final EventBus events;
    private final Clock clock;
    private final WorkProperties props;
    private final String workerId;
    private final JobHistory history;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);

    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultJobQueue(WorkTypeRegistry registry,
                           JobStore jobStore,
                           CompletionTracker tracker,
                           WorkExecutor executor,
                           EventBus events,
                           Clock clock,
                           WorkProperties props,
                           String workerId) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.history = new JobHistory(props.getHistorySize());

        Duration poll = Objects.requireNonNull(props.getQueuePollEvery(), "sentinel.work.queuePollEvery must not be null");
        if (poll.isZero() || poll.isNegative()) {
            throw new IllegalArgumentException("sentinel.work.queuePollEvery must be a positive duration");
        }
        Duration lock = Objects.requireNonNull(props.getJobLockLifetime(), "sentinel.work.jobLockLifetime must not be null");
        if (lock.isZero() || lock.isNegative()) {
            throw new IllegalArgumentException("sentinel.work.jobLockLifetime must be a positive duration");
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("work.queue-poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        wakeSignal.drainPermits();
    }

    /**
     * Request an early sweep, e.g. after a job was enqueued or a worker freed up.
     */
    public void wake() {
        if (wakeSignal.availablePermits() == 0) {
            wakeSignal.release();
        }
    }

    /**
     * Persist a job for the work type. Rejected when no such work type is registered.
     */
    public EnqueueResult enqueue(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Optional<WorkType> workType = registry.get(request.workTypeId());
        if (workType.isEmpty()) {
            log.warn("work job rejected; unknown work type type={}", request.workTypeId());
            return EnqueueResult.rejectedResult("unknown work type: " + request.workTypeId());
        }

        Instant now = clock.instant();
        Job job = new Job(
                null,
                request.workTypeId(),
                request.subject(),
                request.priority() != null ? request.priority() : workType.get().priority(),
                now,
                request.availableAt() != null ? request.availableAt() : now,
                0,
                request.maxRetries() != null ? request.maxRetries() : props.getDefaultMaxRetries(),
                JobStatus.PENDING,
                null,
                null,
                null,
                request.payload()
        );
        Job saved = jobStore.insert(job);

        log.info("work job queued id={} type={} subject={} priority={}",
                saved.id(), saved.workTypeId(), saved.subject(), saved.priority());
        Map<String, Object> data = jobData(saved);
        data.put("priority", saved.priority().label());
        data.put("max_retries", saved.maxRetries());
        events.emit(EventType.JOB_QUEUED, MODULE, data);

        wake();
        return EnqueueResult.queuedResult(saved);
    }

    public Optional<Job> findJob(String jobId) {
        return jobStore.findById(jobId);
    }

    /**
     * Most recent dispatch outcomes first, at most {@code limit} entries.
     */
    public List<JobHistoryEntry> history(int limit) {
        return history.recent(limit);
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce(clock.instant());
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("work queue pollOnce failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                wakeSignal.tryAcquire(props.getQueuePollEvery().toMillis(), TimeUnit.MILLISECONDS);
                wakeSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Retry delay after failed attempt number {@code attempt} (1-based).
     * Defaults: 10s, 20s, 40s, 80s... capped at 10 minutes.
     */
    Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long base = props.getRetryBaseDelay().toMillis();
        long max = props.getRetryMaxDelay().toMillis();
        long ms = Math.min(base * (1L << exp), max);
        return Duration.ofMillis(ms);
    }

    /**
     * One sweep. Returns the number of jobs handed to the executor.
     */
    int pollOnce(Instant now) {
        int capacity = executor.availableCapacity();
        if (capacity == 0) {
            return 0;
        }

        List<Job> claimed = jobStore.claimDue(now, capacity, props.getJobLockLifetime(), workerId);
        if (!claimed.isEmpty()) {
            log.debug("work queue claimed jobs count={} capacity={}", claimed.size(), capacity);
        }

        int dispatched = 0;
        for (Job job : claimed) {
            if (dispatch(job, now)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean dispatch(Job job, Instant now) {
        Optional<WorkType> workType = registry.get(job.workTypeId());
        if (workType.isEmpty()) {
            // Registered when enqueued, gone after a restart with a different catalog.
            fail(job, now, now, "unknown work type: " + job.workTypeId());
            return false;
        }

        WorkItem item = job.item();
        if (executor.isRunningJob(item.id(), job.id())) {
            // Lock expired under a run still in progress here; the claim just renewed it.
            log.warn("work job still running past its lock; claim renewed id={} item={} lockUntil={}",
                    job.id(), item.id(), job.lockUntil());
            return false;
        }
        if (executor.isInFlight(item.id())) {
            defer(job, now);
            return false;
        }

        List<String> missing = new ArrayList<>();
        for (String dep : workType.get().dependsOn()) {
            if (tracker.dependencyCompletion(dep, item.subject()).isEmpty()) {
                missing.add(dep);
            }
        }
        if (!missing.isEmpty()) {
            DependencyNotMetException e = new DependencyNotMetException(item.id(), missing);
            log.warn("work job dependencies not met id={} item={} missing={}", job.id(), item.id(), missing);
            attemptFailed(job, now, e.getMessage());
            return false;
        }

        boolean submitted = executor.submit(workType.get(), item, job.payload(),
                WorkExecutor.SOURCE_QUEUE, job.id(), result -> onResult(job, result));
        if (!submitted) {
            if (executor.isInFlight(item.id())) {
                defer(job, now);
            } else {
                release(job, now);
            }
        }
        return submitted;
    }

    private void onResult(Job job, ExecutionResult result) {
        if (result.succeeded()) {
            succeed(job, result);
        } else {
            attemptFailed(job, result.startedAt(), result.errorMessage());
        }
    }

    private void succeed(Job job, ExecutionResult result) {
        try {
            if (!jobStore.markSucceeded(job.id(), workerId, result.finishedAt())) {
                log.warn("work job claim lost before success write-back id={}", job.id());
            }
        } catch (Exception e) {
            log.error("work job markSucceeded failed id={} msg={}", job.id(), e.getMessage(), e);
        }

        history.add(new JobHistoryEntry(job.id(), job.workTypeId(), job.subject(), JobHistoryEntry.Outcome.SUCCEEDED,
                job.attempt(), result.startedAt(), result.finishedAt(), null, null));
        Map<String, Object> data = jobData(job);
        data.put("attempt", job.attempt());
        events.emit(EventType.JOB_COMPLETED, MODULE, data);
    }

    private void attemptFailed(Job job, Instant startedAt, String error) {
        if (!job.hasRetriesLeft()) {
            log.warn("work job reached max retries id={} type={} attempts={} maxRetries={}",
                    job.id(), job.workTypeId(), job.attempt(), job.maxRetries());
            fail(job, startedAt, clock.instant(), error);
            return;
        }

        Instant failedAt = clock.instant();
        Instant nextAttemptAt = failedAt.plus(retryDelay(job.attempt()));
        try {
            jobStore.markRetry(job.id(), workerId, job.retries() + 1, nextAttemptAt, error);
        } catch (Exception e) {
            log.error("work job markRetry failed id={} msg={}", job.id(), e.getMessage(), e);
        }

        log.info("work job retry scheduled id={} attempt={} nextAttemptAt={}", job.id(), job.attempt(), nextAttemptAt);
        history.add(new JobHistoryEntry(job.id(), job.workTypeId(), job.subject(), JobHistoryEntry.Outcome.RETRY_SCHEDULED,
                job.attempt(), startedAt, failedAt, nextAttemptAt, error));
        Map<String, Object> data = jobData(job);
        data.put("attempt", job.attempt());
        data.put("next_attempt_at", nextAttemptAt.toString());
        data.put("error", error);
        events.emit(EventType.JOB_RETRY_SCHEDULED, MODULE, data);
    }

    private void fail(Job job, Instant startedAt, Instant failedAt, String error) {
        try {
            jobStore.markFailed(job.id(), workerId, job.retries(), failedAt, error);
        } catch (Exception e) {
            log.error("work job markFailed failed id={} msg={}", job.id(), e.getMessage(), e);
        }

        history.add(new JobHistoryEntry(job.id(), job.workTypeId(), job.subject(), JobHistoryEntry.Outcome.FAILED,
                job.attempt(), startedAt, failedAt, null, error));
        Map<String, Object> data = jobData(job);
        data.put("attempts", job.attempt());
        data.put("error", error);
        events.emit(EventType.JOB_FAILED, MODULE, data);
    }

    private void defer(Job job, Instant now) {
        log.debug("work job deferred; item in flight id={} item={}", job.id(), job.item().id());
        giveBack(job, now.plus(props.getInFlightDeferDelay()));
    }

    private void release(Job job, Instant now) {
        giveBack(job, now);
    }

    private void giveBack(Job job, Instant availableAt) {
        try {
            jobStore.release(job.id(), workerId, availableAt);
        } catch (Exception e) {
            log.error("work job release failed id={} msg={}", job.id(), e.getMessage(), e);
        }
    }

    private static Map<String, Object> jobData(Job job) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.id());
        data.put("work_type", job.workTypeId());
        data.put("subject", job.subject());
        return data;
    }
}
