package com.taskherd.engine.plugin;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Identity and contract of a plugin.
 *
 * @param name        Unique identifier used in job records, webhook rules and schedules
 *                    (e.g. "echo", "maven_test").
 * @param version     Free-form version string, shown on the dashboard.
 * @param description One-line summary for the dashboard plugin list.
 * @param parameters  Declared parameter schema; undeclared params are passed through.
 * @param recurrence  Optional default recurrence; a schedule named after the plugin
 *                    is created for it at startup.
 * @param timeout     Optional wall-clock limit per attempt; null = engine default.
 * @param maxAttempts Optional attempt bound; null = engine default.
 */
public record PluginManifest(
        String                name,
        String                version,
        String                description,
        List<ParameterSpec>   parameters,
        RecurrenceDefault     recurrence,
        Duration              timeout,
        Integer               maxAttempts) {

    public PluginManifest {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /** Manifest with no schedule and engine-default limits. */
    public static PluginManifest of(String name, String description, ParameterSpec... parameters) {
        return new PluginManifest(name, "1.0", description, List.of(parameters), null, null, null);
    }

    public PluginManifest withRecurrence(RecurrenceDefault r) {
        return new PluginManifest(name, version, description, parameters, r, timeout, maxAttempts);
    }

    public PluginManifest withTimeout(Duration t) {
        return new PluginManifest(name, version, description, parameters, recurrence, t, maxAttempts);
    }

    public PluginManifest withMaxAttempts(Integer attempts) {
        return new PluginManifest(name, version, description, parameters, recurrence, timeout, attempts);
    }

    public Optional<RecurrenceDefault> recurrenceOpt() {
        return Optional.ofNullable(recurrence);
    }
}
