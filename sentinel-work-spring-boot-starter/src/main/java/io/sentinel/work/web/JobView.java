package io.sentinel.work.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sentinel.work.core.Job;

import java.util.Map;

public record JobView(
        String id,
        @JsonProperty("work_type") String workType,
        String subject,
        String priority,
        String status,
        int retries,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("available_at") String availableAt,
        @JsonProperty("last_error") String lastError,
        Map<String, Object> payload
) {

    public static JobView from(Job job) {
        return new JobView(
                job.id(),
                job.workTypeId(),
                job.subject(),
                job.priority().label(),
                job.status().name().toLowerCase(),
                job.retries(),
                job.maxRetries(),
                WorkTypeStatusView.iso(job.createdAt()),
                WorkTypeStatusView.iso(job.availableAt()),
                job.lastError(),
                job.payload()
        );
    }
}
