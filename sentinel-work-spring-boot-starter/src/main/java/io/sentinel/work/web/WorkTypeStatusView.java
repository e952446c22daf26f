package io.sentinel.work.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sentinel.work.core.WorkTypeStatus;
import io.sentinel.work.utils.IntervalParser;

import java.time.Instant;
import java.util.List;

/**
 * JSON shape of one entry of {@code GET /api/work/status}.
 */
public record WorkTypeStatusView(
        String id,
        String priority,
        @JsonProperty("market_timing") String marketTiming,
        String interval,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("last_run") String lastRun,
        @JsonProperty("next_run") String nextRun
) {

    public static WorkTypeStatusView from(WorkTypeStatus s) {
        return new WorkTypeStatusView(
                s.id(),
                s.priority().label(),
                s.marketTiming().label(),
                IntervalParser.format(s.interval()),
                s.dependsOn(),
                iso(s.lastRun()),
                iso(s.nextRun())
        );
    }

    static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}
