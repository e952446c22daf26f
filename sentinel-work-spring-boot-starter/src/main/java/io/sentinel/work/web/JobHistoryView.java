package io.sentinel.work.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sentinel.work.core.JobHistoryEntry;

public record JobHistoryView(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("work_type") String workType,
        String subject,
        String outcome,
        int attempt,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("finished_at") String finishedAt,
        @JsonProperty("next_attempt_at") String nextAttemptAt,
        String error
) {

    public static JobHistoryView from(JobHistoryEntry e) {
        return new JobHistoryView(
                e.jobId(),
                e.workTypeId(),
                e.subject(),
                e.outcome().name().toLowerCase(),
                e.attempt(),
                WorkTypeStatusView.iso(e.startedAt()),
                WorkTypeStatusView.iso(e.finishedAt()),
                WorkTypeStatusView.iso(e.nextAttemptAt()),
                e.error()
        );
    }
}
