package io.sentinel.work;

import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobHistoryEntry;
import io.sentinel.work.core.JobRequest;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.core.WorkTypeStatus;
import io.sentinel.work.event.EventBus;

import java.util.List;
import java.util.Optional;

/**
 * Work orchestration engine: runs registered {@link WorkType}s on their schedule and on demand.
 *
 * <p>Typical usage:
 * <pre>{@code
 * engine.registry().register(syncPortfolio);
 * engine.start();
 *
 * engine.enqueue(JobRequest.of("planner:weights"));
 * engine.trigger(); // e.g. after a portfolio change
 *
 * engine.stop();
 * }</pre>
 */
public interface WorkEngine {

    /**
     * Freeze the registry, load completion records and start scheduling. Should be idempotent.
     */
    void start();

    /**
     * Stop scheduling, cancel running work and wait the grace period. Should be idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Request a scheduling pass now instead of waiting for the next tick.
     */
    void trigger();

    /**
     * Queue a run of a work type, bypassing its interval and market timing.
     */
    EnqueueResult enqueue(JobRequest request);

    default EnqueueResult enqueue(String workTypeId, String subject) {
        return enqueue(JobRequest.of(workTypeId, subject));
    }

    /**
     * One entry per registered work type, critical first.
     */
    List<WorkTypeStatus> status();

    List<JobHistoryEntry> jobHistory(int limit);

    Optional<Job> findJob(String jobId);

    /**
     * Completion records that could not be written to the durable store since start. Non-zero
     * means status shows completions a restart would not remember.
     */
    long completionPersistFailures();

    WorkTypeRegistry registry();

    EventBus events();
}
