package com.taskherd.engine.service;

public enum CancelOutcome {
    /** Job was still PENDING and is now CANCELLED. */
    CANCELLED,
    /** Job is RUNNING on this node; the plugin was signalled and will end on its own or by timeout. */
    SIGNALLED,
    /** Job is running elsewhere, already finished, or waiting to retry. */
    NOT_CANCELLABLE
}
