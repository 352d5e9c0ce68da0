package com.taskherd.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a Job.
 *
 * Transitions:
 *   PENDING  → RUNNING    (leased by a worker)
 *   PENDING  → CANCELLED  (cancelled before any worker picked it up)
 *   PENDING  → FAILED     (reaper: never picked up within the pending timeout)
 *   RUNNING  → SUCCEEDED  (plugin returned a result)
 *   RUNNING  → FAILED     (plugin raised, exited non-zero, or timed out)
 *   FAILED   → RETRYING   (always; the retry decision happens here)
 *   RETRYING → RUNNING    (leased again after backoff)
 *   RETRYING → ABANDONED  (attempts exhausted or failure not retryable)
 *
 * FAILED is transient: a job never rests there.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    RETRYING,
    ABANDONED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ABANDONED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return successors().contains(target);
    }

    public Set<JobStatus> successors() {
        return switch (this) {
            case PENDING   -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING   -> EnumSet.of(SUCCEEDED, FAILED);
            case FAILED    -> EnumSet.of(RETRYING);
            case RETRYING  -> EnumSet.of(RUNNING, ABANDONED);
            case SUCCEEDED, ABANDONED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
