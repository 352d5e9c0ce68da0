package com.taskherd.engine.plugin;

/**
 * A failed plugin attempt.
 *
 * Unchecked so plugins only catch it when they have a specific recovery
 * strategy. Every instance counts as one failed attempt and goes through the
 * retry policy; {@code detail} carries diagnostic output (e.g. captured
 * process output) that is stored on the job and quoted in reports.
 */
public class PluginException extends RuntimeException {

    public enum Kind { EXECUTION_ERROR, NON_ZERO_EXIT, TIMEOUT, CANCELLED, INVALID_PARAMS }

    private final Kind   kind;
    private final String detail;

    public PluginException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public PluginException(Kind kind, String message, String detail) {
        this(kind, message, detail, null);
    }

    public PluginException(Kind kind, String message, String detail, Throwable cause) {
        super(message, cause);
        this.kind   = kind;
        this.detail = detail;
    }

    public Kind   getKind()   { return kind; }
    public String getDetail() { return detail; }
}
