package com.taskherd.engine.api.dto;

import com.taskherd.engine.plugin.ParameterSpec;
import com.taskherd.engine.plugin.PluginManifest;

import java.util.List;

/** Response body for GET /plugins and GET /plugins/{name}. */
public record PluginResponse(
        String              name,
        String              version,
        String              description,
        List<ParameterSpec> parameters,
        String              recurrence,
        Long                timeoutSeconds,
        Integer             maxAttempts
) {
    public static PluginResponse from(PluginManifest m) {
        String recurrence = m.recurrenceOpt()
                .map(r -> r.cron() != null ? "cron " + r.cron() : "every " + r.interval())
                .orElse(null);
        return new PluginResponse(
                m.name(),
                m.version(),
                m.description(),
                m.parameters(),
                recurrence,
                m.timeout() != null ? m.timeout().toSeconds() : null,
                m.maxAttempts());
    }
}
