package com.taskherd.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * All engine settings, bound from the {@code taskherd.*} namespace.
 *
 * Secrets (webhook secret, GitHub token) are expected to arrive through
 * environment variables referenced from application.yml, never committed.
 */
@ConfigurationProperties(prefix = "taskherd")
public record TaskherdProperties(
        @DefaultValue Plugins   plugins,
        @DefaultValue Worker    worker,
        @DefaultValue Retry     retry,
        @DefaultValue Scheduler scheduler,
        @DefaultValue Reaper    reaper,
        @DefaultValue Webhook   webhook,
        @DefaultValue Reporter  reporter,
        @DefaultValue GitHub    github) {

    /**
     * @param enabled ordered activation list; entries separated by ':' or ','.
     *                Empty means every plugin on the classpath is active.
     * @param shell   externally defined, process-backed plugins
     */
    public record Plugins(
            @DefaultValue("") String enabled,
            @DefaultValue List<ShellPlugin> shell) {}

    public record ShellPlugin(
            String       name,
            List<String> command,
            String       workingDirectory,
            Duration     timeout,
            String       description) {}

    public record Worker(
            @DefaultValue("true")  boolean  enabled,
            @DefaultValue("4")     int      threads,
            @DefaultValue("1s")    Duration pollInterval,
            @DefaultValue("10s")   Duration maxPollInterval,
            @DefaultValue("10m")   Duration defaultTimeout,
            @DefaultValue("15m")   Duration leaseVisibility) {}

    public record Retry(
            @DefaultValue("3")   int      maxAttempts,
            @DefaultValue("2s")  Duration initialDelay,
            @DefaultValue("2.0") double   multiplier,
            @DefaultValue("5m")  Duration maxDelay) {}

    public record Scheduler(
            @DefaultValue("true")  boolean enabled,
            @DefaultValue("10")    int     maxBacklog,
            @DefaultValue("UTC")   String  zone) {}

    public record Reaper(
            @DefaultValue("true") boolean  enabled,
            @DefaultValue("30s")  Duration grace,
            @DefaultValue("1h")   Duration pendingTimeout) {}

    public record Webhook(
            String secret,
            @DefaultValue List<Rule> rules) {}

    /**
     * Maps one inbound event type (optionally narrowed to some actions)
     * onto the plugins that should run for it.
     */
    public record Rule(
            String              event,
            List<String>        actions,
            List<String>        plugins,
            Map<String, Object> params) {

        public boolean matches(String eventType, String action) {
            if (event == null || !event.equals(eventType)) return false;
            return actions == null || actions.isEmpty() || (action != null && actions.contains(action));
        }
    }

    public record Reporter(
            @DefaultValue("true")  boolean  enabled,
            @DefaultValue("5")     int      maxAttempts,
            @DefaultValue("5s")    Duration initialDelay,
            @DefaultValue("2.0")   double   multiplier,
            @DefaultValue("10m")   Duration maxDelay,
            @DefaultValue("2000")  int      maxOutputChars,
            @DefaultValue("20")    int      batchSize) {}

    public record GitHub(
            @DefaultValue("https://api.github.com") String apiUrl,
            String token,
            @DefaultValue("30s") Duration timeout) {}
}
