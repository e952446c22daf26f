package io.sentinel.work.internal.memory;

import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobStatus;
import io.sentinel.work.spi.JobStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JobStore} kept in a map guarded by the store's monitor. Same claim and write-back rules
 * as the Mongo store, without durability.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> DISPATCH_ORDER = Comparator
            .comparing(Job::priority)
            .thenComparing(Job::availableAt)
            .thenComparing(Job::createdAt);

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Job insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.id() != null ? job.id() : UUID.randomUUID().toString();
        Job saved = new Job(id, job.workTypeId(), job.subject(), job.priority(), job.createdAt(), job.availableAt(),
                job.retries(), job.maxRetries(), job.status(), job.lastError(), job.lockedBy(), job.lockUntil(),
                job.payload());
        jobs.put(id, saved);
        return saved;
    }

    @Override
    public synchronized List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        if (limit <= 0) {
            return List.of();
        }
        List<Job> due = jobs.values().stream()
                .filter(j -> isDispatchable(j, now))
                .sorted(DISPATCH_ORDER)
                .limit(limit)
                .toList();

        List<Job> claimed = new ArrayList<>(due.size());
        Instant lockUntil = now.plus(lockLifetime);
        for (Job j : due) {
            Job running = copy(j, JobStatus.RUNNING, j.retries(), j.availableAt(), j.lastError(), workerId, lockUntil);
            jobs.put(j.id(), running);
            claimed.add(running);
        }
        return claimed;
    }

    private static boolean isDispatchable(Job j, Instant now) {
        if (j.status() == JobStatus.PENDING) {
            return !j.availableAt().isAfter(now);
        }
        return j.status() == JobStatus.RUNNING && j.lockUntil() != null && !j.lockUntil().isAfter(now);
    }

    @Override
    public synchronized boolean markSucceeded(String jobId, String workerId, Instant finishedAt) {
        Job j = claimedBy(jobId, workerId);
        if (j == null) {
            return false;
        }
        jobs.put(jobId, copy(j, JobStatus.SUCCEEDED, j.retries(), j.availableAt(), null, null, null));
        return true;
    }

    @Override
    public synchronized boolean markRetry(String jobId, String workerId, int retries, Instant availableAt, String error) {
        Job j = claimedBy(jobId, workerId);
        if (j == null) {
            return false;
        }
        jobs.put(jobId, copy(j, JobStatus.PENDING, retries, availableAt, error, null, null));
        return true;
    }

    @Override
    public synchronized boolean markFailed(String jobId, String workerId, int retries, Instant failedAt, String error) {
        Job j = claimedBy(jobId, workerId);
        if (j == null) {
            return false;
        }
        jobs.put(jobId, copy(j, JobStatus.FAILED, retries, j.availableAt(), error, null, null));
        return true;
    }

    @Override
    public synchronized boolean release(String jobId, String workerId, Instant availableAt) {
        Job j = claimedBy(jobId, workerId);
        if (j == null) {
            return false;
        }
        jobs.put(jobId, copy(j, JobStatus.PENDING, j.retries(), availableAt, j.lastError(), null, null));
        return true;
    }

    @Override
    public synchronized Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<Job> findByStatus(JobStatus status, int limit) {
        return jobs.values().stream()
                .filter(j -> j.status() == status)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    private Job claimedBy(String jobId, String workerId) {
        Job j = jobs.get(jobId);
        if (j == null || j.status() != JobStatus.RUNNING || !Objects.equals(j.lockedBy(), workerId)) {
            return null;
        }
        return j;
    }

    private static Job copy(Job j, JobStatus status, int retries, Instant availableAt, String lastError,
                            String lockedBy, Instant lockUntil) {
        return new Job(j.id(), j.workTypeId(), j.subject(), j.priority(), j.createdAt(), availableAt,
                retries, j.maxRetries(), status, lastError, lockedBy, lockUntil, j.payload());
    }
}
