package io.sentinel.work.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-side description of a job to enqueue. Unset fields fall back to the work type's priority,
 * the configured default max retries and "now".
 */
public final class JobRequest {

    private final String workTypeId;
    private final String subject;
    private final Priority priority;
    private final Integer maxRetries;
    private final Instant availableAt;
    private final Map<String, Object> payload;

    private JobRequest(Builder b) {
        this.workTypeId = b.workTypeId;
        this.subject = b.subject;
        this.priority = b.priority;
        this.maxRetries = b.maxRetries;
        this.availableAt = b.availableAt;
        this.payload = b.payload.isEmpty() ? Map.of() : Map.copyOf(b.payload);
    }

    public static JobRequest of(String workTypeId) {
        return builder(workTypeId).build();
    }

    public static JobRequest of(String workTypeId, String subject) {
        return builder(workTypeId).subject(subject).build();
    }

    public static Builder builder(String workTypeId) {
        return new Builder(workTypeId);
    }

    public String workTypeId() {
        return workTypeId;
    }

    public String subject() {
        return subject;
    }

    /** Null means the work type's priority. */
    public Priority priority() {
        return priority;
    }

    /** Null means the configured default. */
    public Integer maxRetries() {
        return maxRetries;
    }

    /** Null means immediately. */
    public Instant availableAt() {
        return availableAt;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public static final class Builder {
        private final String workTypeId;
        private String subject = WorkItem.NO_SUBJECT;
        private Priority priority;
        private Integer maxRetries;
        private Instant availableAt;
        private final Map<String, Object> payload = new LinkedHashMap<>();

        private Builder(String workTypeId) {
            Objects.requireNonNull(workTypeId, "workTypeId must not be null");
            if (workTypeId.isBlank()) {
                throw new IllegalArgumentException("workTypeId must not be blank");
            }
            this.workTypeId = workTypeId;
        }

        public Builder subject(String subject) {
            this.subject = subject == null ? WorkItem.NO_SUBJECT : subject;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder availableAt(Instant availableAt) {
            this.availableAt = availableAt;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload.clear();
            if (payload != null) {
                payload.forEach(this::put);
            }
            return this;
        }

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (value != null) {
                this.payload.put(key, value);
            }
            return this;
        }

        public JobRequest build() {
            return new JobRequest(this);
        }
    }
}
