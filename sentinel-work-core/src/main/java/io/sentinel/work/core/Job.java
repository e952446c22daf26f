package io.sentinel.work.core;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted request to execute a work type on demand.
 */
public record Job(

        // identity
        String id,
        String workTypeId,
        String subject,

        // scheduling
        Priority priority,
        Instant createdAt,
        Instant availableAt,

        // retry state
        int retries,
        int maxRetries,
        JobStatus status,
        String lastError,

        // claim
        String lockedBy,
        Instant lockUntil,

        // payload
        Map<String, Object> payload
) {

    public Job {
        subject = subject == null ? WorkItem.NO_SUBJECT : subject;
        payload = payload == null ? Map.of() : payload;
    }

    public WorkItem item() {
        return WorkItem.of(workTypeId, subject);
    }

    /**
     * Attempts made so far, counting the one in progress for a running job.
     */
    public int attempt() {
        return retries + 1;
    }

    public boolean hasRetriesLeft() {
        return retries < maxRetries;
    }
}
