package io.sentinel.work.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publish/subscribe hub for engine events.
 *
 * <p>Every subscription owns a bounded buffer drained by its own daemon thread, so handlers run
 * asynchronously and one slow handler cannot delay another. {@link #emit} never blocks: when a
 * subscriber's buffer is full the event is dropped for that subscriber only and a warning is logged.
 */
public class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final CopyOnWriteArrayList<BufferedSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger threadSeq = new AtomicInteger();
    private final int bufferSize;
    private final Clock clock;

    public EventBus() {
        this(DEFAULT_BUFFER_SIZE, Clock.systemUTC());
    }

    public EventBus(int bufferSize, Clock clock) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be a positive number");
        }
        this.bufferSize = bufferSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Subscription subscribe(EventType type, Consumer<Event> handler) {
        Objects.requireNonNull(type, "type must not be null");
        return subscribe(EnumSet.of(type), handler, bufferSize);
    }

    /**
     * Subscribe to a set of types; an empty set receives every type.
     */
    public Subscription subscribe(Set<EventType> types, Consumer<Event> handler) {
        return subscribe(types, handler, bufferSize);
    }

    public Subscription subscribe(Set<EventType> types, Consumer<Event> handler, int capacity) {
        Objects.requireNonNull(types, "types must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be a positive number");
        }

        Set<EventType> filter = types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
        BufferedSubscription sub = new BufferedSubscription(filter, handler, capacity);
        subscriptions.add(sub);
        sub.start("events.subscriber-" + threadSeq.incrementAndGet());
        log.debug("EventBus subscribed types={} capacity={}", filter.isEmpty() ? "*" : filter, capacity);
        return sub;
    }

    public Event emit(EventType type, String module, Map<String, Object> data) {
        Event event = new Event(type, module, clock.instant(), data);
        publish(event);
        return event;
    }

    public void publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        for (BufferedSubscription sub : subscriptions) {
            if (sub.accepts(event.type())) {
                sub.offer(event);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * Close every subscription. Used on engine shutdown.
     */
    public void close() {
        for (BufferedSubscription sub : subscriptions) {
            sub.close();
        }
    }

    private final class BufferedSubscription implements Subscription {
        private final Set<EventType> types;
        private final Consumer<Event> handler;
        private final BlockingQueue<Event> buffer;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final AtomicLong dropped = new AtomicLong();
        private Thread thread;

        private BufferedSubscription(Set<EventType> types, Consumer<Event> handler, int capacity) {
            this.types = types;
            this.handler = handler;
            this.buffer = new ArrayBlockingQueue<>(capacity);
        }

        private void start(String name) {
            thread = new Thread(this::deliverLoop);
            thread.setName(name);
            thread.setDaemon(true);
            thread.start();
        }

        private boolean accepts(EventType type) {
            return active.get() && (types.isEmpty() || types.contains(type));
        }

        private void offer(Event event) {
            if (!buffer.offer(event)) {
                long total = dropped.incrementAndGet();
                log.warn("EventBus subscriber buffer full; dropping event type={} module={} dropped={}",
                        event.type(), event.module(), total);
            }
        }

        private void deliverLoop() {
            while (active.get()) {
                Event event;
                try {
                    event = buffer.poll(500, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (event == null) {
                    continue;
                }
                try {
                    handler.accept(event);
                } catch (Exception e) {
                    log.error("EventBus handler failed type={} msg={}", event.type(), e.getMessage(), e);
                }
            }
        }

        @Override
        public Set<EventType> types() {
            return types;
        }

        @Override
        public long droppedCount() {
            return dropped.get();
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            subscriptions.remove(this);
            buffer.clear();
            if (thread != null && thread != Thread.currentThread()) {
                thread.interrupt();
            }
        }
    }
}
