package com.taskherd.engine.service;

import com.taskherd.engine.model.JobStatus;

import java.util.Set;
import java.util.UUID;

/**
 * A compare-and-set transition found the job in an unexpected state.
 *
 * Usually means a stale caller: a worker finishing a job the reaper has
 * already failed, or two operators cancelling at once. The job is left
 * untouched.
 */
public class InvalidTransitionException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus actual;
    private final JobStatus target;

    public InvalidTransitionException(UUID jobId, JobStatus actual, Set<JobStatus> expected, JobStatus target) {
        this(jobId, actual, target,
                "Job " + jobId + " is " + actual + ", expected one of " + expected + " to move to " + target);
    }

    private InvalidTransitionException(UUID jobId, JobStatus actual, JobStatus target, String message) {
        super(message);
        this.jobId  = jobId;
        this.actual = actual;
        this.target = target;
    }

    /** The job is in the right state, but a later attempt owns it. */
    public static InvalidTransitionException supersededAttempt(UUID jobId, JobStatus actual,
                                                               int expectedAttempt, int actualAttempt,
                                                               JobStatus target) {
        return new InvalidTransitionException(jobId, actual, target,
                "Job " + jobId + " is " + actual + " on attempt " + actualAttempt
                        + ", not attempt " + expectedAttempt + "; refusing to move to " + target);
    }

    public UUID      getJobId()  { return jobId; }
    public JobStatus getActual() { return actual; }
    public JobStatus getTarget() { return target; }
}
