package io.sentinel.work;

import io.sentinel.work.core.WorkItem;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Execution context of one run of a work item.
 *
 * <p>Cancellation is cooperative: long-running bodies should poll {@link #isCancelled()} or call
 * {@link #throwIfCancelled()} between steps. The worker thread is also interrupted when the
 * engine abandons a run on shutdown.
 */
public interface WorkContext {

    WorkItem item();

    /**
     * Payload supplied with a queued job; empty for scheduled runs.
     */
    Map<String, Object> payload();

    /**
     * Time after which the run counts as timed out and {@link #isCancelled()} turns true.
     */
    Instant deadline();

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("work item cancelled: " + item().id());
        }
    }
}
