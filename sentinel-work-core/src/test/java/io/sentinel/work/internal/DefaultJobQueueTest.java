package io.sentinel.work.internal;

import io.sentinel.work.MutableClock;
import io.sentinel.work.WorkType;
import io.sentinel.work.config.WorkProperties;
import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobHistoryEntry;
import io.sentinel.work.core.JobRequest;
import io.sentinel.work.core.JobStatus;
import io.sentinel.work.core.Priority;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.event.Event;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.event.EventType;
import io.sentinel.work.internal.memory.InMemoryCompletionStore;
import io.sentinel.work.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultJobQueueTest {

    private static final Instant T0 = Instant.parse("2026-03-04T15:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final WorkTypeRegistry registry = new WorkTypeRegistry();
    private final InMemoryJobStore jobStore = new InMemoryJobStore();
    private final WorkProperties props = new WorkProperties();
    private final List<Event> received = new CopyOnWriteArrayList<>();

    private EventBus events;
    private CompletionTracker tracker;
    private WorkExecutor executor;
    private DefaultJobQueue queue;

    @BeforeEach
    void setUp() {
        events = new EventBus();
        events.subscribe(Set.of(), received::add);
        tracker = new CompletionTracker(new InMemoryCompletionStore());
        executor = new WorkExecutor(4, tracker, events, clock, Duration.ofMinutes(10), Duration.ofMillis(100));
        executor.start();
        queue = new DefaultJobQueue(registry, jobStore, tracker, executor, events, clock, props, "worker-1");
    }

    @AfterEach
    void tearDown() {
        queue.stop();
        executor.stop(Duration.ofSeconds(1));
        events.close();
    }

    @Test
    void enqueueAppliesWorkTypeDefaults() throws Exception {
        registry.register(WorkType.builder("planner:rebalance").priority(Priority.HIGH).onDemand()
                .execute((ctx, subject, progress) -> { }).build());

        EnqueueResult result = queue.enqueue(JobRequest.of("planner:rebalance"));

        assertThat(result.queued()).isTrue();
        Job job = result.job();
        assertThat(job.id()).isNotBlank();
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.priority()).isEqualTo(Priority.HIGH);
        assertThat(job.maxRetries()).isEqualTo(props.getDefaultMaxRetries());
        assertThat(job.availableAt()).isEqualTo(T0);
        assertThat(waitUntil(() -> hasEvent(EventType.JOB_QUEUED))).isTrue();
    }

    @Test
    void unknownWorkTypeIsRejected() {
        EnqueueResult result = queue.enqueue(JobRequest.of("nope"));

        assertThat(result.rejected()).isTrue();
        assertThat(result.error()).isEqualTo("unknown work type: nope");
        assertThat(jobStore.findByStatus(JobStatus.PENDING, 10)).isEmpty();
    }

    @Test
    void successfulJobRecordsCompletionAndPassesPayload() throws Exception {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        registry.register(WorkType.builder("security:sync").onDemand()
                .execute((ctx, subject, progress) -> seen.set(ctx.payload())).build());

        Job job = queue.enqueue(JobRequest.builder("security:sync").subject("AAPL").put("full", true).build()).job();

        assertThat(queue.pollOnce(clock.instant())).isEqualTo(1);
        assertThat(waitUntil(() -> queue.history(10).size() == 1)).isTrue();

        assertThat(status(job)).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(seen.get()).containsEntry("full", true);
        assertThat(tracker.lastCompletion(WorkItem.of("security:sync", "AAPL"))).contains(T0);
        assertThat(queue.history(10)).singleElement()
                .satisfies(e -> {
                    assertThat(e.outcome()).isEqualTo(JobHistoryEntry.Outcome.SUCCEEDED);
                    assertThat(e.attempt()).isEqualTo(1);
                });
        assertThat(waitUntil(() -> hasEvent(EventType.JOB_COMPLETED))).isTrue();
    }

    @Test
    void maxRetriesAllowsOneAttemptMoreThanRetries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(WorkType.builder("planner:rebalance").onDemand().execute((ctx, subject, progress) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("optimizer diverged");
        }).build());

        Job job = queue.enqueue(JobRequest.builder("planner:rebalance").maxRetries(2).build()).job();

        for (int attempt = 1; attempt <= 3; attempt++) {
            int expectedHistory = attempt;
            assertThat(queue.pollOnce(clock.instant())).isEqualTo(1);
            assertThat(waitUntil(() -> queue.history(10).size() == expectedHistory
                    && executor.inFlightCount() == 0)).isTrue();
            // Nothing is due before the retry delay elapses.
            assertThat(queue.pollOnce(clock.instant())).isZero();
            clock.advance(Duration.ofMinutes(11));
        }
        assertThat(queue.pollOnce(clock.instant())).isZero();

        Job failed = jobStore.findById(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.retries()).isEqualTo(2);
        assertThat(failed.lastError()).isEqualTo("optimizer diverged");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(queue.history(10)).extracting(JobHistoryEntry::outcome).containsExactly(
                JobHistoryEntry.Outcome.FAILED,
                JobHistoryEntry.Outcome.RETRY_SCHEDULED,
                JobHistoryEntry.Outcome.RETRY_SCHEDULED);
        assertThat(tracker.lastCompletion("planner:rebalance")).isEmpty();

        assertThat(waitUntil(() -> hasEvent(EventType.JOB_FAILED))).isTrue();
        Event jobFailed = received.stream().filter(e -> e.type() == EventType.JOB_FAILED).findFirst().orElseThrow();
        assertThat(jobFailed.data())
                .containsEntry("job_id", job.id())
                .containsEntry("attempts", 3)
                .containsEntry("error", "optimizer diverged");
    }

    @Test
    void retryIsScheduledWithBackoff() throws Exception {
        registry.register(WorkType.builder("sync:trades").onDemand().execute((ctx, subject, progress) -> {
            throw new IllegalStateException("broker timeout");
        }).build());

        Job job = queue.enqueue(JobRequest.builder("sync:trades").maxRetries(3).build()).job();
        queue.pollOnce(clock.instant());
        assertThat(waitUntil(() -> queue.history(10).size() == 1)).isTrue();

        Job pending = jobStore.findById(job.id()).orElseThrow();
        assertThat(pending.retries()).isEqualTo(1);
        assertThat(pending.availableAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(pending.lockedBy()).isNull();
        assertThat(queue.history(1).get(0).nextAttemptAt()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void jobForInFlightItemIsDeferredWithoutConsumingAnAttempt() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        registry.register(WorkType.builder("sync:portfolio").onDemand().execute((ctx, subject, progress) ->
                release.await(5, TimeUnit.SECONDS)).build());

        Job first = queue.enqueue(JobRequest.of("sync:portfolio")).job();
        assertThat(queue.pollOnce(clock.instant())).isEqualTo(1);

        Job second = queue.enqueue(JobRequest.of("sync:portfolio")).job();
        assertThat(queue.pollOnce(clock.instant())).isZero();

        Job deferred = jobStore.findById(second.id()).orElseThrow();
        assertThat(deferred.status()).isEqualTo(JobStatus.PENDING);
        assertThat(deferred.retries()).isZero();
        assertThat(deferred.availableAt()).isEqualTo(T0.plus(props.getInFlightDeferDelay()));

        release.countDown();
        assertThat(waitUntil(() -> status(first) == JobStatus.SUCCEEDED)).isTrue();
    }

    @Test
    void jobOutlivingItsLockIsNotRunTwice() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        registry.register(WorkType.builder("planner:rebalance").onDemand().execute((ctx, subject, progress) -> {
            runs.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
        }).build());

        Job job = queue.enqueue(JobRequest.of("planner:rebalance")).job();
        assertThat(queue.pollOnce(clock.instant())).isEqualTo(1);

        clock.advance(props.getJobLockLifetime().plusMinutes(1));
        assertThat(queue.pollOnce(clock.instant())).isZero();

        Job reclaimed = jobStore.findById(job.id()).orElseThrow();
        assertThat(reclaimed.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(reclaimed.lockedBy()).isEqualTo("worker-1");
        assertThat(reclaimed.lockUntil()).isEqualTo(clock.instant().plus(props.getJobLockLifetime()));

        release.countDown();
        assertThat(waitUntil(() -> queue.history(10).size() == 1)).isTrue();
        clock.advance(Duration.ofSeconds(10));
        assertThat(queue.pollOnce(clock.instant())).isZero();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(status(job)).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    void dependencyThatNeverCompletedFailsTheAttempt() {
        registry.register(WorkType.builder("planner:weights").onDemand().execute((ctx, subject, progress) -> { }).build());
        registry.register(WorkType.builder("planner:context").onDemand().dependsOn("planner:weights")
                .execute((ctx, subject, progress) -> { }).build());

        Job job = queue.enqueue(JobRequest.builder("planner:context").maxRetries(1).build()).job();
        assertThat(queue.pollOnce(clock.instant())).isZero();

        Job pending = jobStore.findById(job.id()).orElseThrow();
        assertThat(pending.status()).isEqualTo(JobStatus.PENDING);
        assertThat(pending.retries()).isEqualTo(1);
        assertThat(pending.lastError()).contains("planner:weights");
    }

    @Test
    void jobOfUnregisteredWorkTypeFailsOnDispatch() {
        Job orphan = jobStore.insert(new Job(null, "legacy:report", null, Priority.MEDIUM, T0, T0, 0, 3,
                JobStatus.PENDING, null, null, null, null));

        assertThat(queue.pollOnce(clock.instant())).isZero();

        Job failed = jobStore.findById(orphan.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.lastError()).isEqualTo("unknown work type: legacy:report");
    }

    @Test
    void retryDelayDoublesUpToTheCap() {
        assertThat(queue.retryDelay(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(queue.retryDelay(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(queue.retryDelay(3)).isEqualTo(Duration.ofSeconds(40));
        assertThat(queue.retryDelay(7)).isEqualTo(Duration.ofMinutes(10));
        assertThat(queue.retryDelay(500)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void pollerThreadPicksUpEnqueuedJobs() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        registry.register(WorkType.builder("sync:prices").onDemand().execute((ctx, subject, progress) ->
                ran.countDown()).build());

        queue.start();
        queue.enqueue(JobRequest.of("sync:prices"));

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private JobStatus status(Job job) {
        return jobStore.findById(job.id()).map(Job::status).orElse(null);
    }

    private boolean hasEvent(EventType type) {
        return received.stream().anyMatch(e -> e.type() == type);
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }
}
