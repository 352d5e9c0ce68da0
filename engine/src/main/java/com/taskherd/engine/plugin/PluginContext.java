package com.taskherd.engine.plugin;

import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Runtime context passed to every plugin invocation.
 *
 * @param params    job parameters with declared defaults already applied
 * @param attempt   1 for the first run, 2 for the first retry, ...
 */
public record PluginContext(
        UUID                jobId,
        String              pluginName,
        Map<String, Object> params,
        int                 attempt,
        BooleanSupplier     cancellation) {

    public boolean isCancelled() {
        return cancellation.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    public Object param(String name) {
        return params.get(name);
    }

    /** String value of a parameter, or null when absent. */
    public String stringParam(String name) {
        Object v = params.get(name);
        return v == null ? null : v.toString();
    }
}
