package io.sentinel.work.core;

/**
 * Outcome of an enqueue: either the persisted job, or the reason it was rejected.
 */
public record EnqueueResult(
        boolean queued,
        Job job,
        String error
) {

    public static EnqueueResult queuedResult(Job job) {
        return new EnqueueResult(true, job, null);
    }

    public static EnqueueResult rejectedResult(String error) {
        return new EnqueueResult(false, null, error);
    }

    public boolean rejected() {
        return !queued;
    }
}
