package com.taskherd.engine.api;

import com.taskherd.engine.api.dto.ScheduleRequest;
import com.taskherd.engine.api.dto.ScheduleResponse;
import com.taskherd.engine.model.Schedule;
import com.taskherd.engine.scheduler.ScheduleService;
import com.taskherd.engine.service.JsonColumns;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * GET  /schedules                  all schedules by name
 * POST /schedules                  define a schedule
 * POST /schedules/{name}/enable
 * POST /schedules/{name}/disable
 */
@RestController
@RequestMapping("/schedules")
public class ScheduleController {

    private final ScheduleService schedules;
    private final JsonColumns     json;

    public ScheduleController(ScheduleService schedules, JsonColumns json) {
        this.schedules = schedules;
        this.json      = json;
    }

    @GetMapping
    public List<ScheduleResponse> list() {
        return schedules.list().stream().map(this::toResponse).toList();
    }

    @PostMapping
    public ResponseEntity<ScheduleResponse> create(@RequestBody ScheduleRequest req) {
        Schedule s = schedules.create(req.name(), req.plugin(), req.params(), req.cron(), req.intervalSeconds());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(s));
    }

    @PostMapping("/{name}/enable")
    public ScheduleResponse enable(@PathVariable String name) {
        return toResponse(schedules.setEnabled(name, true));
    }

    @PostMapping("/{name}/disable")
    public ScheduleResponse disable(@PathVariable String name) {
        return toResponse(schedules.setEnabled(name, false));
    }

    private ScheduleResponse toResponse(Schedule s) {
        return ScheduleResponse.from(s, json.readMap(s.getParamsJson()));
    }
}
