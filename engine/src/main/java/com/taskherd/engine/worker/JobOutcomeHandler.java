package com.taskherd.engine.worker;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.retry.RetryPolicy;
import com.taskherd.engine.service.JobPatch;
import com.taskherd.engine.service.JobService;
import com.taskherd.engine.service.JsonColumns;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Records how an attempt ended and decides what happens next.
 *
 * Shared by the worker and the timeout reaper so that every failure, however
 * it was detected, goes through the same retry policy:
 * <pre>
 *   RUNNING|PENDING → FAILED → RETRYING → (re-enqueued after backoff | ABANDONED)
 * </pre>
 * The whole chain commits in one transaction, so FAILED is never observed at rest.
 */
@Component
public class JobOutcomeHandler {

    private static final Logger log = LoggerFactory.getLogger(JobOutcomeHandler.class);

    private final JobService    jobService;
    private final WorkQueue     queue;
    private final JsonColumns   json;
    private final RetryPolicy   retryPolicy;
    private final MeterRegistry meterRegistry;
    private final Clock         clock;

    public JobOutcomeHandler(JobService jobService,
                             WorkQueue queue,
                             JsonColumns json,
                             TaskherdProperties props,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.jobService    = jobService;
        this.queue         = queue;
        this.json          = json;
        this.retryPolicy   = RetryPolicy.from(props.retry());
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * RUNNING → SUCCEEDED with the plugin's result.
     *
     * A result that cannot be stored as JSON counts as a failed attempt.
     *
     * @param attempt the attempt that produced the result; rejected if the
     *                job has since moved on to another attempt
     */
    @Transactional
    public JobStatus succeed(UUID jobId, int attempt, Map<String, Object> result) {
        String resultJson;
        try {
            resultJson = json.write(result);
        } catch (IllegalArgumentException e) {
            return fail(jobId, JobStatus.RUNNING, attempt,
                    new Failure("EXECUTION_ERROR", "Plugin result is not serializable: " + e.getMessage(), null, false));
        }
        Job job = jobService.transition(jobId, Set.of(JobStatus.RUNNING), JobStatus.SUCCEEDED,
                JobPatch.none()
                        .expectAttempt(attempt)
                        .result(resultJson)
                        .clearError()
                        .workerId(null)
                        .finishedAt(clock.instant()));
        log.info("Job {} succeeded on attempt {}", jobId, job.getAttempts());
        count(job, "succeeded");
        return JobStatus.SUCCEEDED;
    }

    /**
     * {@code from} → FAILED → RETRYING, then either re-enqueue with backoff or
     * give up with ABANDONED.
     *
     * A job failed while still PENDING (never picked up) is charged one attempt.
     *
     * @param attempt the attempt being failed, as last seen by the caller
     * @return RETRYING if another attempt was scheduled, otherwise ABANDONED
     * @throws com.taskherd.engine.service.InvalidTransitionException if the job
     *         is no longer in {@code from} on {@code attempt}; nothing is changed
     */
    @Transactional
    public JobStatus fail(UUID jobId, JobStatus from, int attempt, Failure failure) {
        JobPatch patch = JobPatch.none()
                .expectAttempt(attempt)
                .error(failure.kind(), failure.message(), failure.detail())
                .workerId(null);
        Job job = jobService.transition(jobId, Set.of(from), JobStatus.FAILED, patch);
        if (from == JobStatus.PENDING) {
            job = jobService.transition(jobId, Set.of(JobStatus.FAILED), JobStatus.RETRYING,
                    JobPatch.none().attempts(job.getAttempts() + 1));
        } else {
            job = jobService.transition(jobId, Set.of(JobStatus.FAILED), JobStatus.RETRYING, JobPatch.none());
        }

        queue.discard(jobId);

        RetryPolicy policy = retryPolicy.withMaxAttempts(job.getMaxAttempts());
        if (failure.retryable() && policy.canRetry(job.getAttempts())) {
            Duration delay = policy.delayAfter(job.getAttempts());
            Instant next = clock.instant().plus(delay);
            queue.enqueue(jobId, next);
            log.warn("Job {} attempt {}/{} failed ({}: {}); retrying in {}",
                    jobId, job.getAttempts(), job.getMaxAttempts(), failure.kind(), failure.message(), delay);
            count(job, "retried");
            return JobStatus.RETRYING;
        }

        jobService.transition(jobId, Set.of(JobStatus.RETRYING), JobStatus.ABANDONED,
                JobPatch.none().finishedAt(clock.instant()));
        log.error("Job {} abandoned after {} attempt(s): {}: {}",
                jobId, job.getAttempts(), failure.kind(), failure.message());
        count(job, "abandoned");
        return JobStatus.ABANDONED;
    }

    private void count(Job job, String outcome) {
        meterRegistry.counter("taskherd.jobs.outcome",
                "plugin", job.getPluginName(), "outcome", outcome).increment();
    }
}
