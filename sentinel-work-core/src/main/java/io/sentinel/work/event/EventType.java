package io.sentinel.work.event;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {

    WORK_STARTED,
    WORK_PROGRESS,
    WORK_COMPLETED,
    WORK_FAILED,

    JOB_QUEUED,
    JOB_COMPLETED,
    JOB_RETRY_SCHEDULED,
    JOB_FAILED;

    /**
     * Name used on the wire, e.g. "work_completed".
     */
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Case-insensitive lookup by wire or enum name.
     */
    public static Optional<EventType> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst();
    }
}
