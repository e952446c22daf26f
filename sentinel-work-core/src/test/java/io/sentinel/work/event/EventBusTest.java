package io.sentinel.work.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void subscriberShouldReceiveOnlyItsTypes() throws Exception {
        List<Event> received = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.WORK_COMPLETED, received::add);

        bus.emit(EventType.WORK_STARTED, "work", Map.of("item_id", "sync:portfolio"));
        bus.emit(EventType.WORK_COMPLETED, "work", Map.of("item_id", "sync:portfolio"));

        assertThat(waitUntil(2, TimeUnit.SECONDS, () -> !received.isEmpty())).isTrue();
        Thread.sleep(100);
        assertThat(received).hasSize(1);
        Event e = received.get(0);
        assertThat(e.type()).isEqualTo(EventType.WORK_COMPLETED);
        assertThat(e.module()).isEqualTo("work");
        assertThat(e.data()).containsEntry("item_id", "sync:portfolio");
        assertThat(e.timestamp()).isNotNull();
    }

    @Test
    void emptyTypeSetShouldReceiveEverything() throws Exception {
        List<EventType> received = new CopyOnWriteArrayList<>();
        bus.subscribe(Set.of(), e -> received.add(e.type()));

        bus.emit(EventType.JOB_QUEUED, "queue", Map.of());
        bus.emit(EventType.JOB_FAILED, "queue", Map.of());

        assertThat(waitUntil(2, TimeUnit.SECONDS, () -> received.size() == 2)).isTrue();
        assertThat(received).containsExactly(EventType.JOB_QUEUED, EventType.JOB_FAILED);
    }

    @Test
    void slowSubscriberShouldDropWithoutBlockingEmitterOrOthers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Subscription slow = bus.subscribe(Set.of(EventType.WORK_PROGRESS), e -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, 2);
        List<Event> fast = new CopyOnWriteArrayList<>();
        bus.subscribe(Set.of(EventType.WORK_PROGRESS), fast::add, 100);

        long startNanos = System.nanoTime();
        for (int i = 0; i < 20; i++) {
            bus.emit(EventType.WORK_PROGRESS, "work", Map.of("current", i));
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        release.countDown();

        assertThat(elapsedMillis).isLessThan(1000);
        assertThat(slow.droppedCount()).isGreaterThan(0);
        assertThat(waitUntil(2, TimeUnit.SECONDS, () -> fast.size() == 20)).isTrue();
    }

    @Test
    void closedSubscriptionShouldStopReceiving() throws Exception {
        List<Event> received = new CopyOnWriteArrayList<>();
        Subscription sub = bus.subscribe(EventType.JOB_QUEUED, received::add);
        sub.close();

        bus.emit(EventType.JOB_QUEUED, "queue", Map.of());
        Thread.sleep(100);

        assertThat(sub.isActive()).isFalse();
        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void handlerFailureShouldNotKillDelivery() throws Exception {
        List<Event> received = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.WORK_FAILED, e -> {
            received.add(e);
            if (received.size() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        bus.emit(EventType.WORK_FAILED, "work", Map.of());
        bus.emit(EventType.WORK_FAILED, "work", Map.of());

        assertThat(waitUntil(2, TimeUnit.SECONDS, () -> received.size() == 2)).isTrue();
    }

    @Test
    void wireNamesShouldRoundTripCaseInsensitively() {
        assertThat(EventType.JOB_RETRY_SCHEDULED.wireName()).isEqualTo("job_retry_scheduled");
        assertThat(EventType.fromWireName("Work_Completed")).contains(EventType.WORK_COMPLETED);
        assertThat(EventType.fromWireName("nope")).isEmpty();
        assertThat(new EventBus(4, Clock.systemUTC()).subscriberCount()).isZero();
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
