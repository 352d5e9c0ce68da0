package com.taskherd.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /schedules. Exactly one of cron and intervalSeconds.
 */
public record ScheduleRequest(String name, String plugin, Map<String, Object> params,
                              String cron, Long intervalSeconds) {

    public ScheduleRequest {
        if (params == null) params = Map.of();
    }
}
