package io.sentinel.work.internal;

import io.sentinel.work.WorkType;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.core.WorkTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled path: decides which work items run next and hands them to the {@link WorkExecutor}.
 *
 * <p>A single thread runs scheduling passes. A pass is requested by {@link #trigger()}, by
 * {@link #wake()} when an execution settles, and in any case every {@code processEvery}.
 *
 * <p>A scheduled item whose run failed is held back until the next tick or explicit
 * {@link #trigger()}; settle wake-ups alone never re-dispatch it.
 *
 * <p>An item is eligible when its type is not on-demand, it is not in flight, its interval has
 * elapsed, its market timing allows it, and every dependency completed after the item itself last
 * did. Eligible items are dispatched in registry order until the pool is full.
 */
public class WorkProcessor {
    private static final Logger log = LoggerFactory.getLogger(WorkProcessor.class);

    private final WorkTypeRegistry registry;
    private final CompletionTracker tracker;
    private final MarketTimingGate gate;
    private final WorkExecutor executor;
    private final Clock clock;
    private final Duration processEvery;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final Set<String> heldBack = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean releaseHeld = new AtomicBoolean(false);

    private Thread schedulerThread;
    private int systemErrorCount = 0;

    public WorkProcessor(WorkTypeRegistry registry,
                         CompletionTracker tracker,
                         MarketTimingGate gate,
                         WorkExecutor executor,
                         Clock clock,
                         Duration processEvery) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.processEvery = Objects.requireNonNull(processEvery, "processEvery must not be null");
        if (processEvery.isZero() || processEvery.isNegative()) {
            throw new IllegalArgumentException("sentinel.work.processEvery must be a positive duration");
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        schedulerThread = new Thread(this::schedulerLoop);
        schedulerThread.setName("work.scheduler");
        schedulerThread.setDaemon(true);
        schedulerThread.start();
        trigger();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (schedulerThread != null) {
            schedulerThread.interrupt();
            schedulerThread = null;
        }
        wakeSignal.drainPermits();
    }

    /**
     * Request a scheduling pass that also reconsiders items held back after a failure. Never
     * blocks; requests arriving during a pass collapse into one.
     */
    public void trigger() {
        releaseHeld.set(true);
        wake();
    }

    /**
     * Request a scheduling pass for capacity freed by a settled run. Failed items stay held back.
     */
    public void wake() {
        if (wakeSignal.availablePermits() == 0) {
            wakeSignal.release();
        }
    }

    int heldBackCount() {
        return heldBack.size();
    }

    private void schedulerLoop() {
        long nextTick = System.nanoTime() + processEvery.toNanos();
        while (started.get()) {
            try {
                long waitNanos = nextTick - System.nanoTime();
                if (waitNanos > 0) {
                    wakeSignal.tryAcquire(waitNanos, TimeUnit.NANOSECONDS);
                }
                wakeSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!started.get()) {
                break;
            }
            if (System.nanoTime() - nextTick >= 0) {
                releaseHeld.set(true);
                nextTick = System.nanoTime() + processEvery.toNanos();
            }

            try {
                runPass(clock.instant());
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("work scheduling pass failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    // Exponential backoff for repeated pass failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * One scheduling pass. Returns the number of items dispatched.
     */
    int runPass(Instant now) {
        if (releaseHeld.getAndSet(false) && !heldBack.isEmpty()) {
            log.debug("work items released after failure count={}", heldBack.size());
            heldBack.clear();
        }
        int dispatched = 0;
        for (WorkType wt : registry.all()) {
            if (executor.availableCapacity() == 0) {
                log.debug("work pool full; pass ends early dispatched={}", dispatched);
                break;
            }
            if (wt.isOnDemand()) {
                continue;
            }

            List<String> subjects;
            try {
                subjects = wt.findSubjects();
            } catch (Exception e) {
                log.error("work subjects lookup failed type={} msg={}", wt.id(), e.getMessage(), e);
                continue;
            }

            for (String subject : subjects) {
                if (executor.availableCapacity() == 0) {
                    break;
                }
                WorkItem item = WorkItem.of(wt.id(), subject);
                if (isEligible(wt, item, now)
                        && executor.submit(wt, item, Map.of(), WorkExecutor.SOURCE_SCHEDULE, null, this::onResult)) {
                    dispatched++;
                }
            }
        }
        if (dispatched > 0) {
            log.debug("work scheduling pass dispatched={}", dispatched);
        }
        return dispatched;
    }

    private void onResult(ExecutionResult result) {
        if (!result.succeeded()) {
            heldBack.add(result.item().id());
        }
    }

    private boolean isEligible(WorkType wt, WorkItem item, Instant now) {
        if (heldBack.contains(item.id()) || executor.isInFlight(item.id())) {
            return false;
        }
        if (!tracker.isDue(wt, item.subject(), now)) {
            return false;
        }
        if (!gate.allows(wt, item.subject(), now)) {
            return false;
        }
        return dependenciesSatisfied(wt, item);
    }

    private boolean dependenciesSatisfied(WorkType wt, WorkItem item) {
        Optional<Instant> own = tracker.lastCompletion(item);
        for (String dep : wt.dependsOn()) {
            Optional<Instant> depDone = tracker.dependencyCompletion(dep, item.subject());
            if (depDone.isEmpty()) {
                return false;
            }
            if (own.isPresent() && !depDone.get().isAfter(own.get())) {
                return false;
            }
        }
        return true;
    }
}
