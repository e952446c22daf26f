package io.sentinel.work.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code {"status":"queued","job_id":...}} or {@code {"status":"rejected","error":...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
        String status,
        @JsonProperty("job_id") String jobId,
        String error
) {

    public static TriggerResponse queued(String jobId) {
        return new TriggerResponse("queued", jobId, null);
    }

    public static TriggerResponse rejected(String error) {
        return new TriggerResponse("rejected", null, error);
    }
}
