package com.taskherd.engine.worker;

import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginException;
import com.taskherd.engine.plugin.PluginRegistry;
import com.taskherd.engine.queue.Lease;
import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.service.InvalidTransitionException;
import com.taskherd.engine.service.JobPatch;
import com.taskherd.engine.service.JobService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one leased job to completion.
 *
 * The plugin executes on a separate thread so the lease holder can enforce
 * the wall-clock timeout with {@code Future.get}. On timeout the plugin
 * thread is interrupted, which is also its cooperative cancellation signal;
 * a plugin that ignores it keeps its thread but not the job.
 *
 * Every log line emitted while a job runs carries the MDC keys
 * {@code jobId}, {@code plugin} and {@code attempt}.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobService         jobService;
    private final JobOutcomeHandler  outcomes;
    private final PluginRegistry     registry;
    private final WorkQueue          queue;
    private final RunningJobs        runningJobs;
    private final RunDeadlines       deadlines;
    private final Clock              clock;

    // Cached, not fixed: a plugin that ignores interruption must not starve the others.
    private final ExecutorService executions;

    public JobRunner(JobService jobService,
                     JobOutcomeHandler outcomes,
                     PluginRegistry registry,
                     WorkQueue queue,
                     RunningJobs runningJobs,
                     RunDeadlines deadlines,
                     Clock clock) {
        this.jobService  = jobService;
        this.outcomes    = outcomes;
        this.registry    = registry;
        this.queue       = queue;
        this.runningJobs = runningJobs;
        this.deadlines   = deadlines;
        this.clock       = clock;

        AtomicInteger seq = new AtomicInteger();
        this.executions = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "plugin-exec-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        executions.shutdownNow();
    }

    /**
     * Execute the job behind {@code lease} and acknowledge the lease, unless
     * the worker was interrupted, in which case the entry is handed back.
     */
    public void run(Lease lease) {
        UUID jobId = lease.jobId();
        MDC.put("jobId", jobId.toString());
        try {
            Optional<Job> found = jobService.findById(jobId);
            if (found.isEmpty() || found.get().getStatus().isTerminal()) {
                log.debug("Skipping delivery of job {}: {}", jobId,
                        found.map(j -> "already " + j.getStatus()).orElse("no such job"));
                queue.ack(lease);
                return;
            }
            Job job = found.get();
            MDC.put("plugin", job.getPluginName());

            if (job.getStatus() == JobStatus.RUNNING) {
                handleRedelivery(lease, job);
                return;
            }
            if (!registry.contains(job.getPluginName())) {
                rejectUnknownPlugin(job, lease);
                queue.ack(lease);
                return;
            }
            if (execute(lease, job)) {
                queue.ack(lease);
            }
        } catch (InvalidTransitionException e) {
            // Someone else (reaper, operator, another worker) moved the job first.
            log.warn("Stale completion for job {}: {}", jobId, e.getMessage());
            queue.ack(lease);
        } finally {
            MDC.remove("jobId");
            MDC.remove("plugin");
            MDC.remove("attempt");
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    /** @return false if the worker was interrupted and the lease handed back */
    private boolean execute(Lease lease, Job job) {
        UUID   jobId  = job.getId();
        String plugin = job.getPluginName();
        int    attempt = job.getAttempts() + 1;
        MDC.put("attempt", String.valueOf(attempt));

        Job running = jobService.transition(jobId, EnumSet.of(JobStatus.PENDING, JobStatus.RETRYING),
                JobStatus.RUNNING,
                JobPatch.none()
                        .attempts(attempt)
                        .workerId(lease.owner())
                        .startedAt(clock.instant()));
        log.info("Running job {} with plugin '{}' (attempt {}/{})",
                jobId, plugin, attempt, running.getMaxAttempts());

        Duration timeout = deadlines.timeoutFor(plugin);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        PluginContext ctx = new PluginContext(jobId, plugin, jobService.params(running), attempt, cancelled::get);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Map<String, Object>> future = executions.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return registry.execute(plugin, ctx);
            } finally {
                MDC.clear();
            }
        });
        runningJobs.register(jobId, future, cancelled);

        try {
            Map<String, Object> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcomes.succeed(jobId, attempt, result);
        } catch (TimeoutException e) {
            cancelled.set(true);
            future.cancel(true);
            outcomes.fail(jobId, JobStatus.RUNNING, attempt,
                    Failure.timeout("Plugin '" + plugin + "' exceeded its timeout of " + timeout));
        } catch (CancellationException e) {
            outcomes.fail(jobId, JobStatus.RUNNING, attempt,
                    Failure.of(new PluginException(PluginException.Kind.CANCELLED, "Cancelled while running")));
        } catch (ExecutionException e) {
            outcomes.fail(jobId, JobStatus.RUNNING, attempt, toFailure(e.getCause()));
        } catch (InterruptedException e) {
            cancelled.set(true);
            future.cancel(true);
            queue.release(lease, clock.instant());
            log.warn("Worker interrupted while job {} was running; lease released", jobId);
            Thread.currentThread().interrupt();
            return false;
        } finally {
            runningJobs.remove(jobId);
        }
        return true;
    }

    /**
     * The entry came back while the job is still RUNNING: either its worker
     * died, or it is still executing past the lease window.
     */
    private void handleRedelivery(Lease lease, Job job) {
        Instant deadline = deadlines.deadlineFor(job);
        if (clock.instant().isBefore(deadline)) {
            log.debug("Job {} still within its run window; holding entry until {}", job.getId(), deadline);
            queue.release(lease, deadline);
            return;
        }
        outcomes.fail(job.getId(), JobStatus.RUNNING, job.getAttempts(), Failure.leaseExpired(job.getWorkerId()));
        queue.ack(lease);
    }

    private void rejectUnknownPlugin(Job job, Lease lease) {
        int attempt = job.getAttempts() + 1;
        jobService.transition(job.getId(), EnumSet.of(JobStatus.PENDING, JobStatus.RETRYING), JobStatus.RUNNING,
                JobPatch.none()
                        .attempts(attempt)
                        .workerId(lease.owner())
                        .startedAt(clock.instant()));
        outcomes.fail(job.getId(), JobStatus.RUNNING, attempt, Failure.unknownPlugin(job.getPluginName()));
    }

    private static Failure toFailure(Throwable cause) {
        if (cause instanceof PluginException pe) {
            return Failure.of(pe);
        }
        return new Failure(PluginException.Kind.EXECUTION_ERROR.name(), String.valueOf(cause), null, true);
    }
}
