package com.taskherd.engine.worker;

import com.taskherd.engine.plugin.PluginException;

/**
 * Structured error recorded on a failed attempt.
 *
 * @param kind      PluginException kind name, or one of the engine's own kinds below
 * @param detail    diagnostic payload such as captured process output; may be null
 * @param retryable false for failures that another attempt cannot fix
 */
public record Failure(String kind, String message, String detail, boolean retryable) {

    public static final String UNKNOWN_PLUGIN = "UNKNOWN_PLUGIN";
    public static final String LEASE_EXPIRED  = "LEASE_EXPIRED";
    public static final String TIMEOUT        = PluginException.Kind.TIMEOUT.name();

    public static Failure of(PluginException e) {
        boolean retryable = switch (e.getKind()) {
            case CANCELLED, INVALID_PARAMS -> false;
            default -> true;
        };
        return new Failure(e.getKind().name(), e.getMessage(), e.getDetail(), retryable);
    }

    public static Failure timeout(String message) {
        return new Failure(TIMEOUT, message, null, true);
    }

    public static Failure unknownPlugin(String pluginName) {
        return new Failure(UNKNOWN_PLUGIN, "No plugin named '" + pluginName + "' is registered", null, false);
    }

    public static Failure leaseExpired(String previousWorker) {
        return new Failure(LEASE_EXPIRED,
                "Worker " + previousWorker + " lost its lease before finishing", null, true);
    }
}
