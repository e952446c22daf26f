package io.sentinel.work;

import io.sentinel.work.core.MarketTiming;
import io.sentinel.work.core.Priority;
import io.sentinel.work.core.WorkItem;
import io.sentinel.work.utils.IntervalParser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable definition of a recurring or on-demand task.
 *
 * <p>Typical usage:
 * <pre>{@code
 * WorkType sync = WorkType.builder("sync:portfolio")
 *         .priority(Priority.HIGH)
 *         .interval("5 minutes")
 *         .execute((ctx, subject, progress) -> portfolioService.sync())
 *         .build();
 *
 * WorkType technical = WorkType.builder("security:technical")
 *         .marketTiming(MarketTiming.AFTER_MARKET_CLOSE)
 *         .interval("24h")
 *         .dependsOn("security:sync")
 *         .subjects(securityRepository::activeIsins)
 *         .execute((ctx, isin, progress) -> technicals.refresh(isin))
 *         .build();
 * }</pre>
 *
 * <p>An interval of zero marks the type as on-demand: it never runs from the schedule, only when a
 * job for it is enqueued.
 */
public final class WorkType {

    private static final Supplier<List<String>> SINGLE_SUBJECT = () -> List.of(WorkItem.NO_SUBJECT);

    private final String id;
    private final Priority priority;
    private final MarketTiming marketTiming;
    private final Duration interval;
    private final Set<String> dependsOn;
    private final Supplier<List<String>> subjects;
    private final WorkExecution execution;

    private WorkType(Builder b) {
        this.id = b.id;
        this.priority = b.priority;
        this.marketTiming = b.marketTiming;
        this.interval = b.interval;
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(b.dependsOn));
        this.subjects = b.subjects;
        this.execution = b.execution;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public Priority priority() {
        return priority;
    }

    public MarketTiming marketTiming() {
        return marketTiming;
    }

    public Duration interval() {
        return interval;
    }

    public boolean isOnDemand() {
        return interval.isZero();
    }

    public Set<String> dependsOn() {
        return dependsOn;
    }

    /**
     * Current subjects this type fans out over. Never null; may be empty.
     */
    public List<String> findSubjects() {
        List<String> found = subjects.get();
        return found == null ? List.of() : found;
    }

    public void execute(WorkContext context, String subject, ProgressReporter progress) throws Exception {
        execution.execute(context, subject, progress == null ? ProgressReporter.noop() : progress);
    }

    @Override
    public String toString() {
        return "WorkType{" + id + ", " + priority + ", " + marketTiming + ", interval=" + IntervalParser.format(interval) + "}";
    }

    public static final class Builder {
        private final String id;
        private Priority priority = Priority.MEDIUM;
        private MarketTiming marketTiming = MarketTiming.ANY_TIME;
        private Duration interval = Duration.ZERO;
        private final List<String> dependsOn = new ArrayList<>();
        private Supplier<List<String>> subjects = SINGLE_SUBJECT;
        private WorkExecution execution;

        private Builder(String id) {
            Objects.requireNonNull(id, "id must not be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            this.id = id;
        }

        public Builder priority(Priority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        public Builder marketTiming(MarketTiming marketTiming) {
            this.marketTiming = Objects.requireNonNull(marketTiming, "marketTiming must not be null");
            return this;
        }

        public Builder interval(Duration interval) {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("interval must not be negative");
            }
            this.interval = interval;
            return this;
        }

        /**
         * Interval as text: "5 minutes", "1 hour 30 minutes", "5m", "300" (seconds) or "0" for on-demand.
         */
        public Builder interval(String interval) {
            Objects.requireNonNull(interval, "interval must not be null");
            if ("0".equals(interval.trim())) {
                return interval(Duration.ZERO);
            }
            return interval(IntervalParser.parseDuration(interval));
        }

        public Builder onDemand() {
            return interval(Duration.ZERO);
        }

        public Builder dependsOn(String... workTypeIds) {
            for (String dep : workTypeIds) {
                Objects.requireNonNull(dep, "dependency id must not be null");
                if (dep.equals(id)) {
                    throw new IllegalArgumentException("work type must not depend on itself: " + id);
                }
                dependsOn.add(dep);
            }
            return this;
        }

        public Builder subjects(Supplier<List<String>> subjects) {
            this.subjects = Objects.requireNonNull(subjects, "subjects must not be null");
            return this;
        }

        public Builder execute(WorkExecution execution) {
            this.execution = Objects.requireNonNull(execution, "execution must not be null");
            return this;
        }

        public WorkType build() {
            if (execution == null) {
                throw new IllegalStateException("execute(...) must be set for work type " + id);
            }
            return new WorkType(this);
        }
    }
}
