package com.taskherd.engine.plugin;

import java.util.Map;

/**
 * Every executable unit the engine can schedule is registered as a TaskPlugin.
 *
 * Implementations are discovered as Spring beans (or contributed by a
 * {@link PluginSource}) and activated by name at startup; see
 * {@link PluginRegistry}.
 *
 * <p>Execution is at-least-once. A worker crash or an expired lease can run
 * the same job again, so any side effect a plugin performs (posting a
 * comment, writing a file) must tolerate being repeated.
 */
public interface TaskPlugin {

    /** Identity, parameter schema and execution limits. */
    PluginManifest manifest();

    /**
     * Run the plugin for one job attempt.
     *
     * Called on a worker thread under a wall-clock timeout. On timeout or
     * cancellation the thread is interrupted and {@link PluginContext#isCancelled()}
     * turns true; long-running plugins should check one of the two.
     *
     * @return result mapping stored on the job (must be JSON-serializable)
     * @throws PluginException on any failure that should count as a failed attempt
     */
    Map<String, Object> execute(PluginContext ctx) throws PluginException;
}
