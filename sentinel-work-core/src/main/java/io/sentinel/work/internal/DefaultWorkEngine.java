package io.sentinel.work.internal;

import io.sentinel.work.WorkEngine;
import io.sentinel.work.WorkType;
import io.sentinel.work.config.WorkProperties;
import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobHistoryEntry;
import io.sentinel.work.core.JobRequest;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.core.WorkTypeStatus;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.spi.CompletionStore;
import io.sentinel.work.spi.JobStore;
import io.sentinel.work.spi.MarketHours;
import io.sentinel.work.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the registry, completion tracker, market timing gate, worker pool, scheduler and job queue
 * into one {@link WorkEngine}.
 */
public class DefaultWorkEngine implements WorkEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultWorkEngine.class);

    private final WorkProperties props;
    private final WorkTypeRegistry registry;
    private final EventBus events;
    private final Clock clock;
    private final String workerId;

    private final CompletionTracker tracker;
    private final WorkExecutor executor;
    private final WorkProcessor processor;
    private final DefaultJobQueue queue;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultWorkEngine(WorkProperties props,
                             WorkTypeRegistry registry,
                             CompletionStore completionStore,
                             JobStore jobStore,
                             MarketHours marketHours,
                             EventBus events,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workerId = resolveWorkerId(props.getWorkerId());

        this.tracker = new CompletionTracker(completionStore);
        MarketTimingGate gate = new MarketTimingGate(marketHours, clock);
        this.executor = new WorkExecutor(props.getMaxConcurrency(), tracker, events, clock,
                props.getExecutionTimeout(), props.getProgressThrottle());
        this.processor = new WorkProcessor(registry, tracker, gate, executor, clock, props.getProcessEvery());
        this.queue = new DefaultJobQueue(registry, jobStore, tracker, executor, events, clock, props, workerId);

        executor.onSettled(() -> {
            processor.wake();
            queue.wake();
        });
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Work engine starting with workTypes={}, maxConcurrency={}, processEvery={}, queuePollEvery={}, executionTimeout={}, workerId={}",
                registry.size(),
                props.getMaxConcurrency(),
                props.getProcessEvery(),
                props.getQueuePollEvery(),
                props.getExecutionTimeout(),
                workerId);

        registry.freeze();
        tracker.load();
        executor.start();
        queue.start();
        processor.start();

        log.info("Work engine started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Work engine stopping...");
        processor.stop();
        queue.stop();
        executor.stop(props.getShutdownGracePeriod());
        log.info("Work engine stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void trigger() {
        processor.trigger();
    }

    @Override
    public EnqueueResult enqueue(JobRequest request) {
        return queue.enqueue(request);
    }

    @Override
    public List<WorkTypeStatus> status() {
        return registry.all().stream()
                .map(this::statusOf)
                .toList();
    }

    private WorkTypeStatus statusOf(WorkType wt) {
        Instant lastRun = tracker.latestForType(wt.id()).orElse(null);
        Duration interval = wt.interval();
        Instant nextRun = (lastRun != null && !interval.isZero()) ? lastRun.plus(interval) : null;
        return new WorkTypeStatus(
                wt.id(),
                wt.priority(),
                wt.marketTiming(),
                interval,
                List.copyOf(wt.dependsOn()),
                lastRun,
                nextRun
        );
    }

    @Override
    public List<JobHistoryEntry> jobHistory(int limit) {
        return queue.history(limit);
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return queue.findJob(jobId);
    }

    @Override
    public long completionPersistFailures() {
        return tracker.persistFailureCount();
    }

    @Override
    public WorkTypeRegistry registry() {
        return registry;
    }

    @Override
    public EventBus events() {
        return events;
    }

    public String workerId() {
        return workerId;
    }

    CompletionTracker tracker() {
        return tracker;
    }

    WorkProcessor processor() {
        return processor;
    }

    DefaultJobQueue queue() {
        return queue;
    }

    @Override
    public String toString() {
        return "DefaultWorkEngine{workTypes=" + registry.size()
                + ", processEvery=" + IntervalParser.format(props.getProcessEvery())
                + ", workerId=" + workerId + "}";
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "sentinel-work";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("hostname lookup failed; using default msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
