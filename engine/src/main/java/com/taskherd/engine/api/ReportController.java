package com.taskherd.engine.api;

import com.taskherd.engine.api.dto.ReportTaskResponse;
import com.taskherd.engine.model.ReportStatus;
import com.taskherd.engine.report.ReportService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * GET  /reports?status=FAILED   report tasks, newest first
 * POST /reports/{id}/retry      requeue a FAILED report with a fresh attempt budget
 */
@RestController
@RequestMapping("/reports")
public class ReportController {

    private final ReportService reports;

    public ReportController(ReportService reports) {
        this.reports = reports;
    }

    @GetMapping
    public List<ReportTaskResponse> list(@RequestParam(required = false) ReportStatus status) {
        return reports.list(status).stream().map(ReportTaskResponse::from).toList();
    }

    @PostMapping("/{id}/retry")
    public ReportTaskResponse retry(@PathVariable UUID id) {
        return ReportTaskResponse.from(reports.retry(id));
    }
}
