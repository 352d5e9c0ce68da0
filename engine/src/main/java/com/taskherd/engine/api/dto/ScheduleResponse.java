package com.taskherd.engine.api.dto;

import com.taskherd.engine.model.Schedule;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScheduleResponse(
        UUID                id,
        String              name,
        String              plugin,
        Map<String, Object> params,
        String              cron,
        Long                intervalSeconds,
        boolean             enabled,
        Instant             lastEnqueued,
        Instant             createdAt
) {
    public static ScheduleResponse from(Schedule s, Map<String, Object> params) {
        return new ScheduleResponse(
                s.getId(),
                s.getName(),
                s.getPluginName(),
                params,
                s.getCronExpression(),
                s.getIntervalSeconds(),
                s.isEnabled(),
                s.getLastEnqueued(),
                s.getCreatedAt());
    }
}
