package com.taskherd.engine.api.dto;

import com.taskherd.engine.model.ReportTask;

import java.time.Instant;
import java.util.UUID;

public record ReportTaskResponse(
        UUID    id,
        UUID    jobId,
        String  target,
        String  status,
        int     attempts,
        Instant nextAttemptAt,
        String  lastError,
        Instant createdAt,
        Instant deliveredAt
) {
    public static ReportTaskResponse from(ReportTask r) {
        return new ReportTaskResponse(
                r.getId(),
                r.getJobId(),
                r.getTarget(),
                r.getStatus().name(),
                r.getAttempts(),
                r.getNextAttemptAt(),
                r.getLastError(),
                r.getCreatedAt(),
                r.getDeliveredAt());
    }
}
