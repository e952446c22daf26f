package io.sentinel.work.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one work type for status reporting.
 * {@code nextRun} is null for on-demand types and for types that have never completed.
 */
public record WorkTypeStatus(
        String id,
        Priority priority,
        MarketTiming marketTiming,
        Duration interval,
        List<String> dependsOn,
        Instant lastRun,
        Instant nextRun
) {
}
