package com.taskherd.engine.api;

import com.taskherd.engine.api.dto.JobResponse;
import com.taskherd.engine.api.dto.PageResponse;
import com.taskherd.engine.api.dto.TriggerJobRequest;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.service.CancelOutcome;
import com.taskherd.engine.service.JobFilter;
import com.taskherd.engine.service.JobNotFoundException;
import com.taskherd.engine.service.JobRequest;
import com.taskherd.engine.service.JobService;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Dashboard API for jobs.
 *
 * GET  /jobs                 list, filtered by status, plugin and creation time
 * GET  /jobs/summary         job counts per status
 * GET  /jobs/{id}            one job
 * GET  /jobs/{id}/result     the result of a finished job
 * POST /jobs                 trigger a one-off job
 * POST /jobs/{id}/cancel     cancel a pending job, or signal a running one
 * POST /jobs/{id}/relaunch   run the same plugin and params again as a new job
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final int MAX_PAGE_SIZE = 200;

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    public PageResponse<JobResponse> list(
            @RequestParam(required = false) JobStatus status,
            @RequestParam(required = false) String plugin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        PageRequest pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return PageResponse.from(jobService.findJobs(new JobFilter(status, plugin, from, to), pageable), this::toResponse);
    }

    @GetMapping("/summary")
    public Map<String, Long> summary() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jobService.countByStatus().forEach((s, n) -> counts.put(s.name(), n));
        return counts;
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return toResponse(load(id));
    }

    /**
     * HTTP 200: job SUCCEEDED, body is its result mapping
     * HTTP 202: job not finished yet
     * HTTP 409: job ended without a result (ABANDONED or CANCELLED)
     */
    @GetMapping("/{id}/result")
    public ResponseEntity<Map<String, Object>> getResult(@PathVariable UUID id) {
        Job job = load(id);
        if (job.getStatus() == JobStatus.SUCCEEDED) {
            return ResponseEntity.ok(jobService.result(job));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId",  job.getId().toString());
        body.put("status", job.getStatus().name());
        if (!job.getStatus().isTerminal()) {
            return ResponseEntity.accepted().body(body);
        }
        if (job.getErrorKind() != null) {
            body.put("errorKind",    job.getErrorKind());
            body.put("errorMessage", job.getErrorMessage());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    /**
     * Trigger a one-off job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"plugin":"echo","params":{"x":"hi"}}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> trigger(@RequestBody TriggerJobRequest req) {
        if (req.plugin() == null || req.plugin().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "plugin is required");
        }
        UUID id = jobService.createJob(JobRequest.manual(req.plugin(), req.params(), req.scheduledAt()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(load(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID id) {
        CancelOutcome outcome = jobService.cancel(id);
        Map<String, Object> body = Map.of("jobId", id.toString(), "outcome", outcome.name());
        return outcome == CancelOutcome.NOT_CANCELLABLE
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(body)
                : ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/relaunch")
    public ResponseEntity<JobResponse> relaunch(@PathVariable UUID id) {
        UUID newId = jobService.relaunch(id);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(load(newId)));
    }

    // ------------------------------------------------------------------

    private Job load(UUID id) {
        return jobService.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    private JobResponse toResponse(Job job) {
        return JobResponse.from(job, jobService.params(job), jobService.result(job));
    }
}
