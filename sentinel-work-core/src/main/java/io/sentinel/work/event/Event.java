package io.sentinel.work.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification published on the {@link EventBus}.
 * {@code data} keeps insertion order and may contain null values.
 */
public record Event(
        EventType type,
        String module,
        Instant timestamp,
        Map<String, Object> data
) {

    public Event {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        data = data == null || data.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
