package com.taskherd.engine.service;

import com.taskherd.engine.model.JobOrigin;

import java.time.Instant;
import java.util.Map;

/**
 * Everything needed to create a job.
 *
 * @param scheduledAt    null = run as soon as possible
 * @param correlationKey deduplication key; null = a unique manual key is generated
 * @param reportTarget   where to post the outcome (e.g. "owner/repo#42"); null = don't report
 */
public record JobRequest(
        String              pluginName,
        Map<String, Object> params,
        Instant             scheduledAt,
        String              correlationKey,
        JobOrigin           origin,
        String              reportTarget) {

    public static JobRequest manual(String pluginName, Map<String, Object> params, Instant scheduledAt) {
        return new JobRequest(pluginName, params, scheduledAt, null, JobOrigin.MANUAL, null);
    }
}
