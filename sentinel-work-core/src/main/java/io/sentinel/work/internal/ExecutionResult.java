package io.sentinel.work.internal;

import io.sentinel.work.core.WorkItem;

import java.time.Instant;

/**
 * How one run of a work item ended. {@code error} is null on success.
 */
record ExecutionResult(
        WorkItem item,
        String runId,
        Instant startedAt,
        Instant finishedAt,
        Throwable error
) {

    boolean succeeded() {
        return error == null;
    }

    String errorMessage() {
        if (error == null) {
            return null;
        }
        String msg = error.getMessage();
        return msg == null ? error.getClass().getName() : msg;
    }
}
