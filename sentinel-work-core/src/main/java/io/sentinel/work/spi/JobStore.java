package io.sentinel.work.spi;

import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of queued jobs.
 *
 * <p>Write-backs ({@code markSucceeded}, {@code markRetry}, {@code markFailed}, {@code release}) only
 * apply while the caller still holds the claim, so a job re-claimed after lock expiry is not
 * overwritten by a stale worker.
 */
public interface JobStore {

    /**
     * Persist a new job. The returned job carries the assigned id.
     */
    Job insert(Job job);

    /**
     * Atomically claim at most {@code limit} dispatchable jobs, marking them {@link JobStatus#RUNNING}
     * and locked by {@code workerId} until {@code now + lockLifetime}.
     *
     * <p>Dispatchable: PENDING with {@code availableAt <= now}, or RUNNING with an expired lock.
     * Order: priority (critical first), then {@code availableAt}, then {@code createdAt}.
     */
    List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId);

    boolean markSucceeded(String jobId, String workerId, Instant finishedAt);

    boolean markRetry(String jobId, String workerId, int retries, Instant availableAt, String error);

    boolean markFailed(String jobId, String workerId, int retries, Instant failedAt, String error);

    /**
     * Give a claimed job back without counting an attempt.
     */
    boolean release(String jobId, String workerId, Instant availableAt);

    Optional<Job> findById(String jobId);

    /**
     * Most recently created first.
     */
    List<Job> findByStatus(JobStatus status, int limit);
}
