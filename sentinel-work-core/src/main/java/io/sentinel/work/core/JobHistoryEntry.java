package io.sentinel.work.core;

import java.time.Instant;

/**
 * One dispatch of a queued job and how it ended.
 *
 * outcome : SUCCEEDED, RETRY_SCHEDULED or FAILED
 * attempt : 1-based attempt number of this dispatch
 */
public record JobHistoryEntry(
        String jobId,
        String workTypeId,
        String subject,
        Outcome outcome,
        int attempt,
        Instant startedAt,
        Instant finishedAt,
        Instant nextAttemptAt,
        String error
) {

    public enum Outcome {
        SUCCEEDED,
        RETRY_SCHEDULED,
        FAILED
    }
}
