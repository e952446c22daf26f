package io.sentinel.work.core;

/**
 * Scheduling priority of a work type. Declaration order is the scheduling order:
 * when several items are eligible at once, {@link #CRITICAL} runs first.
 */
public enum Priority {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Lower-case name used in status payloads (e.g. "critical").
     */
    public String label() {
        return name().toLowerCase();
    }
}
