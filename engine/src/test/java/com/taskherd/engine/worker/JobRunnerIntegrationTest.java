package com.taskherd.engine.worker;

import com.taskherd.engine.IntegrationTestSupport;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobOrigin;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.queue.Lease;
import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.repository.JobRepository;
import com.taskherd.engine.service.CancelOutcome;
import com.taskherd.engine.service.JobPatch;
import com.taskherd.engine.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end execution through the durable queue: lease, run, ack. The
 * worker pool is off in tests, so each test leases and runs by hand.
 */
class JobRunnerIntegrationTest extends IntegrationTestSupport {

    private static final String   OWNER      = "worker-test-1";
    private static final Duration VISIBILITY = Duration.ofMinutes(1);

    @Autowired JobService    jobService;
    @Autowired JobRunner     runner;
    @Autowired WorkQueue     queue;
    @Autowired JobRepository jobRepo;

    @Test
    void echo_succeedsWithItsParameterAsResult() {
        UUID id = jobService.createJob("echo", Map.of("x", "hi"), null, "runner-echo");

        runner.run(queue.lease(OWNER, VISIBILITY).orElseThrow());

        Job job = jobService.findById(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getFinishedAt()).isNotNull();
        assertThat(job.getWorkerId()).isNull();
        assertThat(jobService.result(job)).isEqualTo(Map.of("return_value", "hi"));
        assertThat(queue.depth()).isZero();
    }

    @Test
    void alwaysFailing_isRetriedThenAbandoned() {
        UUID id = jobService.createJob("boom", Map.of(), null, "runner-boom");

        drain();

        Job job = jobService.findById(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.ABANDONED);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getErrorKind()).isEqualTo("EXECUTION_ERROR");
        assertThat(job.getErrorMessage()).isEqualTo("boom on attempt 3");
        assertThat(queue.depth()).isZero();
    }

    @Test
    void overrunningPlugin_isTimedOut() {
        UUID id = jobService.createJob("slow", Map.of(), null, "runner-slow");

        runner.run(queue.lease(OWNER, VISIBILITY).orElseThrow());

        Job job = jobService.findById(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.ABANDONED);
        assertThat(job.getErrorKind()).isEqualTo(Failure.TIMEOUT);
        assertThat(job.getAttempts()).isEqualTo(1);
    }

    @Test
    void unregisteredPlugin_isAbandonedWithoutRetry() {
        Job orphan = new Job("retired", "{}", "runner-orphan", JobOrigin.MANUAL, 3);
        orphan.setCreatedAt(clock.instant());
        UUID id = jobRepo.save(orphan).getId();
        queue.enqueue(id, clock.instant());

        runner.run(queue.lease(OWNER, VISIBILITY).orElseThrow());

        Job job = jobService.findById(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.ABANDONED);
        assertThat(job.getErrorKind()).isEqualTo(Failure.UNKNOWN_PLUGIN);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(queue.depth()).isZero();
    }

    @Test
    void cancelledJobDelivered_isJustAcknowledged() {
        UUID id = jobService.createJob("echo", Map.of("x", "never"), null, "runner-cancelled");
        assertThat(jobService.cancel(id)).isEqualTo(CancelOutcome.CANCELLED);

        queue.lease(OWNER, VISIBILITY).ifPresent(runner::run);

        assertThat(jobService.findById(id).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(queue.depth()).isZero();
    }

    @Test
    void redeliveredWhileOwnerStillWithinDeadline_isHeldBack() {
        UUID id = runningElsewhere("runner-held");

        runner.run(queue.lease(OWNER, VISIBILITY).orElseThrow());

        assertThat(jobService.findById(id).orElseThrow().getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(queue.depth()).isEqualTo(1);
        assertThat(queue.lease(OWNER, VISIBILITY)).isEmpty();
    }

    @Test
    void redeliveredAfterDeadline_failsWithLeaseExpired() {
        UUID id = runningElsewhere("runner-expired");
        clock.advance(Duration.ofMinutes(2));

        runner.run(queue.lease(OWNER, VISIBILITY).orElseThrow());

        Job job = jobService.findById(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RETRYING);
        assertThat(job.getErrorKind()).isEqualTo(Failure.LEASE_EXPIRED);
        assertThat(queue.depth()).isEqualTo(1);
    }

    @Test
    void scheduledInFuture_isNotDeliveredEarly() {
        Instant later = clock.instant().plus(Duration.ofHours(1));
        jobService.createJob("echo", Map.of("x", "later"), later, "runner-later");

        assertThat(queue.lease(OWNER, VISIBILITY)).isEmpty();

        clock.advance(Duration.ofHours(1));
        assertThat(queue.lease(OWNER, VISIBILITY)).isPresent();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Lease and run until nothing is left, stepping the clock over retry delays. */
    private void drain() {
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(1));
            Optional<Lease> lease = queue.lease(OWNER, VISIBILITY);
            if (lease.isEmpty()) {
                return;
            }
            runner.run(lease.get());
        }
    }

    /** A job another worker claimed moments ago; its queue entry is visible again. */
    private UUID runningElsewhere(String key) {
        UUID id = jobService.createJob("echo", Map.of("x", "busy"), null, key);
        jobService.transition(id, Set.of(JobStatus.PENDING), JobStatus.RUNNING,
                JobPatch.none().attempts(1).workerId("worker-other-1").startedAt(clock.instant()));
        return id;
    }
}
