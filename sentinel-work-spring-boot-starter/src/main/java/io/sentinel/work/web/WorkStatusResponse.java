package io.sentinel.work.web;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WorkStatusResponse(
        @JsonProperty("work_types") List<WorkTypeStatusView> workTypes
) {
}
