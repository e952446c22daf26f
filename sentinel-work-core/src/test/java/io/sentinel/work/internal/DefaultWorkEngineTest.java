package io.sentinel.work.internal;

import io.sentinel.work.MutableClock;
import io.sentinel.work.WorkType;
import io.sentinel.work.config.WorkProperties;
import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.JobStatus;
import io.sentinel.work.core.Priority;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.core.WorkTypeStatus;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.internal.memory.InMemoryCompletionStore;
import io.sentinel.work.internal.memory.InMemoryJobStore;
import io.sentinel.work.spi.CompletionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultWorkEngineTest {

    private static final Instant T0 = Instant.parse("2026-03-04T15:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryCompletionStore completionStore = new InMemoryCompletionStore();
    private final InMemoryJobStore jobStore = new InMemoryJobStore();
    private final EventBus events = new EventBus();

    private DefaultWorkEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
        events.close();
    }

    @Test
    void statusReportsNextRunFromLastCompletion() {
        WorkTypeRegistry registry = new WorkTypeRegistry(List.of(
                WorkType.builder("sync:portfolio").priority(Priority.CRITICAL).interval("5m")
                        .execute((ctx, subject, progress) -> { }).build(),
                WorkType.builder("planner:weights").onDemand()
                        .execute((ctx, subject, progress) -> { }).build()));
        engine = newEngine(registry);

        engine.tracker().markCompletedAt(WorkItem.global("sync:portfolio"), T0);
        engine.tracker().markCompletedAt(WorkItem.global("planner:weights"), T0);
        clock.advance(Duration.ofMinutes(2));

        List<WorkTypeStatus> status = engine.status();

        assertThat(status).extracting(WorkTypeStatus::id).containsExactly("sync:portfolio", "planner:weights");
        WorkTypeStatus portfolio = status.get(0);
        assertThat(portfolio.lastRun()).isEqualTo(T0);
        assertThat(portfolio.nextRun()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(Duration.between(clock.instant(), portfolio.nextRun())).isEqualTo(Duration.ofMinutes(3));

        WorkTypeStatus weights = status.get(1);
        assertThat(weights.lastRun()).isEqualTo(T0);
        assertThat(weights.nextRun()).isNull();
    }

    @Test
    void statusOfNeverRunTypeHasNoTimestamps() {
        engine = newEngine(new WorkTypeRegistry(List.of(
                WorkType.builder("sync:prices").interval("5m").execute((ctx, subject, progress) -> { }).build())));

        assertThat(engine.status()).singleElement().satisfies(s -> {
            assertThat(s.lastRun()).isNull();
            assertThat(s.nextRun()).isNull();
            assertThat(s.interval()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    void statusOfPerSubjectTypeUsesLatestSubjectCompletion() {
        engine = newEngine(new WorkTypeRegistry(List.of(
                WorkType.builder("security:sync").interval("24h").subjects(() -> List.of("A", "B"))
                        .execute((ctx, subject, progress) -> { }).build())));

        engine.tracker().markCompletedAt(WorkItem.of("security:sync", "A"), T0.minusSeconds(60));
        engine.tracker().markCompletedAt(WorkItem.of("security:sync", "B"), T0);

        assertThat(engine.status().get(0).lastRun()).isEqualTo(T0);
    }

    @Test
    void emptyRegistryHasEmptyStatus() {
        engine = newEngine(new WorkTypeRegistry());

        assertThat(engine.status()).isEmpty();
    }

    @Test
    void startAndStopAreIdempotent() {
        engine = newEngine(new WorkTypeRegistry());

        engine.start();
        engine.start();
        assertThat(engine.isRunning()).isTrue();
        assertThat(engine.registry().isFrozen()).isTrue();

        engine.stop();
        engine.stop();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void registryIsFrozenOnceStarted() {
        WorkTypeRegistry registry = new WorkTypeRegistry();
        engine = newEngine(registry);
        engine.start();

        assertThatThrownBy(() -> registry.register(WorkType.builder("sync:late").interval("5m")
                .execute((ctx, subject, progress) -> { }).build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void scheduledAndQueuedWorkRunOnStartedEngine() throws Exception {
        CountDownLatch scheduled = new CountDownLatch(1);
        CountDownLatch manual = new CountDownLatch(1);
        engine = newEngine(new WorkTypeRegistry(List.of(
                WorkType.builder("sync:portfolio").interval("5m")
                        .execute((ctx, subject, progress) -> scheduled.countDown()).build(),
                WorkType.builder("planner:rebalance").onDemand()
                        .execute((ctx, subject, progress) -> manual.countDown()).build())));

        engine.start();
        EnqueueResult result = engine.enqueue("planner:rebalance", null);

        assertThat(result.queued()).isTrue();
        assertThat(scheduled.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manual.await(5, TimeUnit.SECONDS)).isTrue();
        String jobId = result.job().id();
        assertThat(waitUntil(() -> engine.findJob(jobId)
                .map(j -> j.status() == JobStatus.SUCCEEDED).orElse(false))).isTrue();
        assertThat(engine.jobHistory(10)).hasSize(1);
    }

    @Test
    void failingScheduledWorkWaitsForNextTick() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        engine = newEngine(new WorkTypeRegistry(List.of(
                WorkType.builder("sync:prices").interval("5m").execute((ctx, subject, progress) -> {
                    runs.incrementAndGet();
                    throw new IllegalStateException("quote feed down");
                }).build())));

        engine.start();

        assertThat(waitUntil(() -> runs.get() >= 1)).isTrue();
        Thread.sleep(1000);
        assertThat(runs.get()).isEqualTo(1);

        engine.trigger();
        assertThat(waitUntil(() -> runs.get() == 2)).isTrue();
    }

    @Test
    void persistFailuresAreReported() {
        CompletionStore failing = new InMemoryCompletionStore() {
            @Override
            public void saveIfLater(String itemId, Instant completedAt) {
                throw new IllegalStateException("mongo down");
            }
        };
        WorkProperties props = new WorkProperties();
        props.setWorkerId("test-worker");
        engine = new DefaultWorkEngine(props, new WorkTypeRegistry(), failing, jobStore, new StubMarketHours(true),
                events, clock);

        engine.tracker().markCompletedAt(WorkItem.global("sync:portfolio"), T0);

        assertThat(engine.completionPersistFailures()).isEqualTo(1);
    }

    @Test
    void completionsSurviveRestart() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        WorkType portfolio = WorkType.builder("sync:portfolio").interval("5m")
                .execute((ctx, subject, progress) -> ran.countDown()).build();
        engine = newEngine(new WorkTypeRegistry(List.of(portfolio)));
        engine.start();
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(waitUntil(() -> completionStore.loadAll().containsKey("sync:portfolio"))).isTrue();
        engine.stop();

        engine = newEngine(new WorkTypeRegistry(List.of(portfolio)));
        engine.tracker().load();

        assertThat(engine.status().get(0).lastRun()).isEqualTo(T0);
    }

    private DefaultWorkEngine newEngine(WorkTypeRegistry registry) {
        WorkProperties props = new WorkProperties();
        props.setWorkerId("test-worker");
        props.setQueuePollEvery(Duration.ofMillis(50));
        props.setShutdownGracePeriod(Duration.ofSeconds(1));
        return new DefaultWorkEngine(props, registry, completionStore, jobStore, new StubMarketHours(true), events, clock);
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
