package io.sentinel.work.web;

import io.sentinel.work.WorkEngine;
import io.sentinel.work.core.EnqueueResult;
import io.sentinel.work.core.JobRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/work")
public class WorkStatusController {

    static final int MAX_HISTORY_LIMIT = 1000;

    private final WorkEngine engine;

    public WorkStatusController(WorkEngine engine) {
        this.engine = engine;
    }

    /**
     * Every registered work type with its last and next run, critical first.
     */
    @GetMapping("/status")
    public WorkStatusResponse status() {
        return new WorkStatusResponse(engine.status().stream().map(WorkTypeStatusView::from).toList());
    }

    /**
     * Queue a run now, bypassing interval and market timing.
     */
    @PostMapping("/{workTypeId}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String workTypeId,
                                                   @RequestParam(required = false) String subject,
                                                   @RequestBody(required = false) Map<String, Object> payload) {
        JobRequest request = JobRequest.builder(workTypeId)
                .subject(subject)
                .payload(payload)
                .build();
        EnqueueResult result = engine.enqueue(request);
        if (result.rejected()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(TriggerResponse.rejected(result.error()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TriggerResponse.queued(result.job().id()));
    }

    @GetMapping("/jobs/history")
    public Map<String, List<JobHistoryView>> history(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_HISTORY_LIMIT));
        return Map.of("jobs", engine.jobHistory(bounded).stream().map(JobHistoryView::from).toList());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobView> job(@PathVariable String jobId) {
        return engine.findJob(jobId)
                .map(JobView::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
