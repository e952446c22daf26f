package io.sentinel.work.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.sentinel.work.core.Job;
import io.sentinel.work.core.JobStatus;
import io.sentinel.work.spi.JobStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence of queued jobs in {@code work_jobs}.
 *
 * <p>Claims use {@code findAndModify}, one document at a time, so two pollers never claim the same
 * job. Write-backs match on {@code lockedBy}: a worker whose lock expired and whose job was claimed
 * again cannot overwrite the new claim.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Job insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        QueuedJobDocument saved = mongoTemplate.insert(toDocument(job));
        return toJob(saved);
    }

    /**
     * Atomically claims (locks) at most {@code limit} dispatchable jobs.
     *
     * <p>A job is dispatchable when:
     * <ul>
     *   <li>it is PENDING and {@code availableAt <= now}</li>
     *   <li>or it is RUNNING and its lock expired: {@code lockUntil <= now}</li>
     * </ul>
     */
    @Override
    public List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query baseQuery = new Query(new Criteria().orOperator(
                Criteria.where("status").is(JobStatus.PENDING).and("availableAt").lte(now),
                Criteria.where("status").is(JobStatus.RUNNING).and("lockUntil").lte(now)
        ));
        baseQuery.with(Sort.by(
                Sort.Order.asc("priorityRank"),
                Sort.Order.asc("availableAt"),
                Sort.Order.asc("createdAt")));

        Update lockUpdate = new Update()
                .set("status", JobStatus.RUNNING)
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Job> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            QueuedJobDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, QueuedJobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toJob(doc));
        }
        return claimed;
    }

    @Override
    public boolean markSucceeded(String jobId, String workerId, Instant finishedAt) {
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Update u = unlock(new Update())
                .set("status", JobStatus.SUCCEEDED)
                .set("finishedAt", finishedAt)
                .unset("lastError");
        return updateClaimed(jobId, workerId, u);
    }

    @Override
    public boolean markRetry(String jobId, String workerId, int retries, Instant availableAt, String error) {
        Objects.requireNonNull(availableAt, "availableAt must not be null");
        Update u = unlock(new Update())
                .set("status", JobStatus.PENDING)
                .set("retries", retries)
                .set("availableAt", availableAt)
                .set("lastError", error);
        return updateClaimed(jobId, workerId, u);
    }

    @Override
    public boolean markFailed(String jobId, String workerId, int retries, Instant failedAt, String error) {
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        Update u = unlock(new Update())
                .set("status", JobStatus.FAILED)
                .set("retries", retries)
                .set("finishedAt", failedAt)
                .set("lastError", error);
        return updateClaimed(jobId, workerId, u);
    }

    @Override
    public boolean release(String jobId, String workerId, Instant availableAt) {
        Objects.requireNonNull(availableAt, "availableAt must not be null");
        Update u = unlock(new Update())
                .set("status", JobStatus.PENDING)
                .set("availableAt", availableAt);
        return updateClaimed(jobId, workerId, u);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, QueuedJobDocument.class)).map(this::toJob);
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) {
        Objects.requireNonNull(status, "status must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("status").is(status))
                .with(Sort.by(Sort.Order.desc("createdAt")))
                .limit(limit);
        return mongoTemplate.find(q, QueuedJobDocument.class).stream().map(this::toJob).toList();
    }

    private boolean updateClaimed(String jobId, String workerId, Update update) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(jobId)
                        // Prevent stale write-back if another worker already re-claimed this job.
                        .and("lockedBy").is(workerId)
                        .and("status").is(JobStatus.RUNNING)
        );
        UpdateResult r = mongoTemplate.updateFirst(q, update, QueuedJobDocument.class);
        return r.getModifiedCount() > 0;
    }

    private static Update unlock(Update u) {
        return u.unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
    }

    QueuedJobDocument toDocument(Job job) {
        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setId(job.id());
        doc.setWorkTypeId(job.workTypeId());
        doc.setSubject(job.subject());
        doc.setPriority(job.priority());
        doc.setPriorityRank(job.priority().ordinal());
        doc.setCreatedAt(job.createdAt());
        doc.setAvailableAt(job.availableAt());
        doc.setStatus(job.status());
        doc.setRetries(job.retries());
        doc.setMaxRetries(job.maxRetries());
        doc.setLastError(job.lastError());
        doc.setLockedBy(job.lockedBy());
        doc.setLockUntil(job.lockUntil());
        if (!job.payload().isEmpty()) {
            doc.setPayload(objectMapper.convertValue(job.payload(), new TypeReference<>() {
            }));
        }
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     */
    Job toJob(QueuedJobDocument doc) {
        Map<String, Object> payload = doc.getPayload() == null ? Map.of() :
                objectMapper.convertValue(doc.getPayload(), new TypeReference<Map<String, Object>>() {
                });
        return new Job(
                doc.getId(),
                doc.getWorkTypeId(),
                doc.getSubject(),
                doc.getPriority(),
                doc.getCreatedAt(),
                doc.getAvailableAt(),
                doc.getRetries(),
                doc.getMaxRetries(),
                doc.getStatus(),
                doc.getLastError(),
                doc.getLockedBy(),
                doc.getLockUntil(),
                payload
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
