package io.sentinel.work.event;

import java.util.Set;

/**
 * Handle to an event bus registration. Closing it stops delivery and releases the delivery thread.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Types this subscription receives; empty means every type.
     */
    Set<EventType> types();

    /**
     * Events discarded because this subscriber's buffer was full.
     */
    long droppedCount();

    boolean isActive();

    @Override
    void close();
}
