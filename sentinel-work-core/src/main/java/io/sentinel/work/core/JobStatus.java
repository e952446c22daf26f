package io.sentinel.work.core;

public enum JobStatus {
    /** Waiting for {@code availableAt}; also the state between retry attempts. */
    PENDING,
    /** Claimed by a worker. A running job whose lock expired is claimable again. */
    RUNNING,
    SUCCEEDED,
    /** Retries exhausted. Terminal; never dispatched again. */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
