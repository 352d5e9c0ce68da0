package com.taskherd.engine.api.dto;

import com.taskherd.engine.model.Job;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for GET /jobs, GET /jobs/{id} and POST /jobs.
 * The result is only present once the job has SUCCEEDED.
 */
public record JobResponse(
        UUID                id,
        String              plugin,
        String              status,
        String              origin,
        Map<String, Object> params,
        int                 attempts,
        int                 maxAttempts,
        Map<String, Object> result,
        ErrorBody           error,
        String              reportTarget,
        Instant             createdAt,
        Instant             scheduledAt,
        Instant             startedAt,
        Instant             finishedAt
) {
    public record ErrorBody(String kind, String message, String detail) {}

    public static JobResponse from(Job job, Map<String, Object> params, Map<String, Object> result) {
        return new JobResponse(
                job.getId(),
                job.getPluginName(),
                job.getStatus().name(),
                job.getOrigin().name(),
                params,
                job.getAttempts(),
                job.getMaxAttempts(),
                job.getResultJson() != null ? result : null,
                job.getErrorKind() != null
                        ? new ErrorBody(job.getErrorKind(), job.getErrorMessage(), job.getErrorDetail())
                        : null,
                job.getReportTarget(),
                job.getCreatedAt(),
                job.getScheduledAt(),
                job.getStartedAt(),
                job.getFinishedAt()
        );
    }
}
