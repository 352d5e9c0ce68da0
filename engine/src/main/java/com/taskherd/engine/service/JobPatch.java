package com.taskherd.engine.service;

import com.taskherd.engine.model.Job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Field changes applied together with a status transition.
 *
 * Only the fields that were explicitly set are touched, so a patch can
 * also clear a field (e.g. {@link #clearError()} on success).
 */
public final class JobPatch {

    private final List<Consumer<Job>> changes = new ArrayList<>();
    private Integer                   expectedAttempt;

    private JobPatch() {}

    public static JobPatch none() {
        return new JobPatch();
    }

    /**
     * Fence: the transition only applies while the job is still on this
     * attempt, so an outcome reported by a superseded attempt is rejected.
     */
    public JobPatch expectAttempt(int attempt) {
        this.expectedAttempt = attempt;
        return this;
    }

    public JobPatch attempts(int attempts) {
        changes.add(j -> j.setAttempts(attempts));
        return this;
    }

    public JobPatch workerId(String workerId) {
        changes.add(j -> j.setWorkerId(workerId));
        return this;
    }

    public JobPatch startedAt(Instant t) {
        changes.add(j -> j.setStartedAt(t));
        return this;
    }

    public JobPatch finishedAt(Instant t) {
        changes.add(j -> j.setFinishedAt(t));
        return this;
    }

    public JobPatch result(String resultJson) {
        changes.add(j -> j.setResultJson(resultJson));
        return this;
    }

    public JobPatch error(String kind, String message, String detail) {
        changes.add(j -> {
            j.setErrorKind(kind);
            j.setErrorMessage(message);
            j.setErrorDetail(detail);
        });
        return this;
    }

    public JobPatch clearError() {
        return error(null, null, null);
    }

    Integer expectedAttempt() {
        return expectedAttempt;
    }

    boolean admits(Job job) {
        return expectedAttempt == null || job.getAttempts() == expectedAttempt;
    }

    void applyTo(Job job) {
        changes.forEach(c -> c.accept(job));
    }
}
