package com.taskherd.engine.scheduler;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.service.InvalidTransitionException;
import com.taskherd.engine.service.JobService;
import com.taskherd.engine.worker.Failure;
import com.taskherd.engine.worker.JobOutcomeHandler;
import com.taskherd.engine.worker.RunDeadlines;
import com.taskherd.engine.worker.RunningJobs;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Forces stuck jobs into FAILED so nothing stays RUNNING or PENDING forever.
 *
 * <ul>
 *   <li>RUNNING past start + plugin timeout + grace: the worker died or
 *       hung without returning.</li>
 *   <li>PENDING and due for longer than {@code pending-timeout}: nobody
 *       picked it up.</li>
 * </ul>
 * Both go through the normal retry path. Every transition is a
 * compare-and-set, so a job that finishes while the reaper looks at it is
 * simply skipped.
 */
@Component
@ConditionalOnProperty(prefix = "taskherd.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TimeoutReaper {

    private static final Logger log = LoggerFactory.getLogger(TimeoutReaper.class);

    private final JobService        jobService;
    private final JobOutcomeHandler outcomes;
    private final RunDeadlines      deadlines;
    private final RunningJobs       runningJobs;
    private final MeterRegistry     meterRegistry;
    private final Clock             clock;
    private final Duration          pendingTimeout;

    public TimeoutReaper(JobService jobService,
                         JobOutcomeHandler outcomes,
                         RunDeadlines deadlines,
                         RunningJobs runningJobs,
                         TaskherdProperties props,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.jobService     = jobService;
        this.outcomes       = outcomes;
        this.deadlines      = deadlines;
        this.runningJobs    = runningJobs;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
        this.pendingTimeout = props.reaper().pendingTimeout();
    }

    /** @return number of jobs forced into FAILED */
    @Scheduled(fixedDelayString = "${taskherd.reaper.interval:PT30S}",
               initialDelayString = "${taskherd.reaper.initial-delay:PT15S}")
    public int reap() {
        Instant now = clock.instant();
        int reaped = 0;

        for (Job job : jobService.findByStatus(JobStatus.RUNNING)) {
            Instant deadline = deadlines.deadlineFor(job);
            if (now.isAfter(deadline)) {
                String message = "Still RUNNING on " + job.getWorkerId() + " after its "
                        + deadlines.timeoutFor(job.getPluginName()) + " timeout";
                if (force(job, JobStatus.RUNNING, Failure.timeout(message))) {
                    runningJobs.signal(job.getId());
                    reaped++;
                }
            }
        }

        for (Job job : jobService.findPendingDueBefore(now.minus(pendingTimeout))) {
            String message = "Not picked up within " + pendingTimeout + " of becoming due";
            if (force(job, JobStatus.PENDING, Failure.timeout(message))) {
                reaped++;
            }
        }

        if (reaped > 0) {
            log.warn("Reaper forced {} stuck job(s) into FAILED", reaped);
        }
        return reaped;
    }

    private boolean force(Job job, JobStatus from, Failure failure) {
        try {
            JobStatus next = outcomes.fail(job.getId(), from, job.getAttempts(), failure);
            log.warn("Reaped {} job {} (plugin '{}'): now {}", from, job.getId(), job.getPluginName(), next);
            meterRegistry.counter("taskherd.reaper.reaped", "from", from.name()).increment();
            return true;
        } catch (InvalidTransitionException e) {
            log.debug("Job {} moved on before it could be reaped: {}", job.getId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to reap job {}: {}", job.getId(), e.getMessage(), e);
            return false;
        }
    }
}
