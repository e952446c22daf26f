package io.sentinel.work.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentinel.work.event.Event;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.event.EventType;
import io.sentinel.work.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams engine events as newline-delimited JSON.
 *
 * <p>The first frame is {@code {"type":"connected"}}; a {@code heartbeat} frame follows every
 * heartbeat interval; every other frame is {@code {type, module, timestamp, data}}.
 */
@RestController
@RequestMapping("/api/events")
public class EventStreamController implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);

    private final EventBus events;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration heartbeatInterval;
    private final ScheduledExecutorService heartbeats;

    public EventStreamController(EventBus events, ObjectMapper objectMapper, Clock clock, Duration heartbeatInterval) {
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("sentinel.work.heartbeatInterval must be a positive duration");
        }
        this.events = events;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.heartbeatInterval = heartbeatInterval;
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("work.events-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param types comma-separated wire names such as {@code work_completed,job_failed}; absent means all
     */
    @GetMapping(value = "/stream", produces = "application/x-ndjson")
    public ResponseBodyEmitter stream(@RequestParam(required = false) String types) {
        Set<EventType> filter = parseTypes(types);

        ResponseBodyEmitter emitter = newEmitter();
        Stream stream = new Stream(emitter);

        stream.send(controlFrame("connected"));
        if (stream.closed.get()) {
            return emitter;
        }
        stream.attach(
                events.subscribe(filter, event -> stream.send(eventFrame(event))),
                heartbeats.scheduleAtFixedRate(
                        () -> stream.send(controlFrame("heartbeat")),
                        heartbeatInterval.toMillis(),
                        heartbeatInterval.toMillis(),
                        TimeUnit.MILLISECONDS));

        emitter.onCompletion(stream::close);
        emitter.onTimeout(stream::close);
        emitter.onError(e -> stream.close());

        log.debug("event stream opened types={}", filter.isEmpty() ? "all" : filter);
        return emitter;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }

    @Override
    public void destroy() {
        heartbeats.shutdownNow();
    }

    ResponseBodyEmitter newEmitter() {
        return new ResponseBodyEmitter(0L);
    }

    static Set<EventType> parseTypes(String types) {
        Set<EventType> out = EnumSet.noneOf(EventType.class);
        if (types == null || types.isBlank()) {
            return out;
        }
        for (String raw : types.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            out.add(EventType.fromWireName(name)
                    .orElseThrow(() -> new IllegalArgumentException("unknown event type: " + name)));
        }
        return out;
    }

    private Map<String, Object> controlFrame(String type) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        frame.put("timestamp", clock.instant().toString());
        return frame;
    }

    private static Map<String, Object> eventFrame(Event event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.type().wireName());
        frame.put("module", event.module());
        frame.put("timestamp", event.timestamp().toString());
        frame.put("data", event.data());
        return frame;
    }

    private final class Stream {
        private final ResponseBodyEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile Subscription subscription;
        private volatile ScheduledFuture<?> heartbeat;

        private Stream(ResponseBodyEmitter emitter) {
            this.emitter = emitter;
        }

        // Releases immediately when the stream closed before or during attach.
        private void attach(Subscription s, ScheduledFuture<?> h) {
            subscription = s;
            heartbeat = h;
            if (closed.get()) {
                s.close();
                h.cancel(false);
            }
        }

        private synchronized void send(Map<String, Object> frame) {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(objectMapper.writeValueAsString(frame) + "\n", MediaType.TEXT_PLAIN);
            } catch (JsonProcessingException e) {
                log.error("event frame serialization failed type={} msg={}", frame.get("type"), e.getMessage(), e);
            } catch (IOException | IllegalStateException e) {
                log.debug("event stream client gone msg={}", e.getMessage());
                close();
                emitter.completeWithError(e);
            }
        }

        private void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Subscription s = subscription;
            if (s != null) {
                s.close();
            }
            ScheduledFuture<?> h = heartbeat;
            if (h != null) {
                h.cancel(false);
            }
            log.debug("event stream closed");
        }
    }
}
