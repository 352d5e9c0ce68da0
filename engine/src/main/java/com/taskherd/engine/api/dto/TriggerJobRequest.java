package com.taskherd.engine.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * Required: plugin
 * Optional: params (defaults to empty), scheduledAt (null = run now)
 */
public record TriggerJobRequest(String plugin, Map<String, Object> params, Instant scheduledAt) {

    public TriggerJobRequest {
        if (params == null) params = Map.of();
    }
}
