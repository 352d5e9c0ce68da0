package com.taskherd.engine.service;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobOrigin;
import com.taskherd.engine.model.JobStatus;
import com.taskherd.engine.plugin.PluginRegistry;
import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.report.ReportService;
import com.taskherd.engine.repository.JobRepository;
import com.taskherd.engine.worker.RunningJobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The job store: idempotent creation, compare-and-set transitions and
 * dashboard queries.
 *
 * Every write goes through {@link #createJob} or {@link #transition}; nothing
 * else in the engine saves a Job.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository       jobRepo;
    private final WorkQueue           queue;
    private final PluginRegistry      registry;
    private final ReportService       reports;
    private final RunningJobs         runningJobs;
    private final JsonColumns         json;
    private final TaskherdProperties  props;
    private final Clock               clock;
    private final TransactionTemplate newTx;

    public JobService(JobRepository jobRepo,
                      WorkQueue queue,
                      PluginRegistry registry,
                      ReportService reports,
                      RunningJobs runningJobs,
                      JsonColumns json,
                      TaskherdProperties props,
                      Clock clock,
                      PlatformTransactionManager txManager) {
        this.jobRepo     = jobRepo;
        this.queue       = queue;
        this.registry    = registry;
        this.reports     = reports;
        this.runningJobs = runningJobs;
        this.json        = json;
        this.props       = props;
        this.clock       = clock;
        this.newTx       = new TransactionTemplate(txManager);
        this.newTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /** Short form used by the scheduler and tests. */
    public UUID createJob(String pluginName, Map<String, Object> params,
                          Instant scheduledAt, String correlationKey) {
        return createJob(new JobRequest(pluginName, params, scheduledAt, correlationKey,
                JobOrigin.MANUAL, null));
    }

    /**
     * Create a job and enqueue it, at most once per correlation key.
     *
     * If a job with the same key already exists its id is returned and
     * nothing is written. The insert runs in its own transaction; when two
     * callers race on the same key the loser's insert hits the unique
     * constraint, rolls back, and it returns the winner's id instead.
     *
     * @throws com.taskherd.engine.plugin.PluginNotFoundException     unknown plugin
     * @throws com.taskherd.engine.plugin.InvalidParametersException  missing required params
     */
    public UUID createJob(JobRequest req) {
        String key = req.correlationKey() != null ? req.correlationKey() : "manual:" + UUID.randomUUID();

        Optional<Job> existing = jobRepo.findByCorrelationKey(key);
        if (existing.isPresent()) {
            log.debug("Job for key '{}' already exists: {}", key, existing.get().getId());
            return existing.get().getId();
        }

        Map<String, Object> params = registry.applySchema(req.pluginName(), req.params());
        int maxAttempts = registry.maxAttemptsFor(req.pluginName(), props.retry().maxAttempts());

        try {
            UUID id = newTx.execute(status -> insert(req, key, params, maxAttempts));
            log.info("Created job {} (plugin={}, origin={}, key={})", id, req.pluginName(), req.origin(), key);
            return id;
        } catch (DataAccessException e) {
            // Lost a race on the same key: the other creator's job is the one.
            return jobRepo.findByCorrelationKey(key)
                    .map(winner -> {
                        log.debug("Concurrent create for key '{}' resolved to job {}", key, winner.getId());
                        return winner.getId();
                    })
                    .orElseThrow(() -> e);
        }
    }

    private UUID insert(JobRequest req, String key, Map<String, Object> params, int maxAttempts) {
        Instant now = clock.instant();
        Job job = new Job(req.pluginName(), json.write(params), key, req.origin(), maxAttempts);
        job.setCreatedAt(now);
        job.setScheduledAt(req.scheduledAt());
        job.setReportTarget(req.reportTarget());
        job = jobRepo.saveAndFlush(job);

        Instant availableAt = req.scheduledAt() != null && req.scheduledAt().isAfter(now) ? req.scheduledAt() : now;
        queue.enqueue(job.getId(), availableAt);
        return job.getId();
    }

    /** Re-run a job's plugin and params as a fresh one-off job. */
    public UUID relaunch(UUID jobId) {
        Job original = findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return createJob(JobRequest.manual(original.getPluginName(), params(original), null));
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * Compare-and-set: move the job to {@code to} only if its current status is
     * one of {@code from} and the edge exists in the state machine; apply
     * {@code patch} in the same write.
     *
     * Reaching a terminal state with a report target also creates the job's
     * ReportTask, in the same transaction.
     *
     * @throws InvalidTransitionException job not in an expected state, or no longer on the
     *                                    attempt the patch expects; nothing changed
     * @throws JobNotFoundException       no such job
     */
    @Transactional
    public Job transition(UUID jobId, Set<JobStatus> from, JobStatus to, JobPatch patch) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobStatus current = job.getStatus();
        if (!from.contains(current) || !current.canTransitionTo(to)) {
            throw new InvalidTransitionException(jobId, current, from, to);
        }
        if (!patch.admits(job)) {
            throw InvalidTransitionException.supersededAttempt(jobId, current, patch.expectedAttempt(),
                    job.getAttempts(), to);
        }
        patch.applyTo(job);
        job.setStatus(to);
        job = jobRepo.save(job);
        log.debug("Job {} {} → {}", jobId, current, to);

        if (to.isTerminal() && job.getReportTarget() != null) {
            reports.createFor(job);
        }
        return job;
    }

    /**
     * Cancel a job.
     *
     * Only a PENDING job can be cancelled outright. A job running on this
     * node gets a cancellation signal; its plugin may stop early, otherwise
     * the timeout resolves it.
     */
    @Transactional
    public CancelOutcome cancel(UUID jobId) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus() == JobStatus.PENDING) {
            transition(jobId, Set.of(JobStatus.PENDING), JobStatus.CANCELLED,
                    JobPatch.none().finishedAt(clock.instant()));
            log.info("Job {} cancelled before it started", jobId);
            return CancelOutcome.CANCELLED;
        }
        if (job.getStatus() == JobStatus.RUNNING && runningJobs.signal(jobId)) {
            log.info("Job {} is running here; cancellation signalled", jobId);
            return CancelOutcome.SIGNALLED;
        }
        return CancelOutcome.NOT_CANCELLABLE;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public Page<Job> findJobs(JobFilter filter, Pageable page) {
        return jobRepo.findAll(filter.toSpecification(), page);
    }

    @Transactional(readOnly = true)
    public List<Job> findByStatus(JobStatus status) {
        return jobRepo.findByStatus(status);
    }

    /** PENDING jobs that became due before {@code cutoff} and still haven't started. */
    @Transactional(readOnly = true)
    public List<Job> findPendingDueBefore(Instant cutoff) {
        return jobRepo.findPendingDueBefore(cutoff);
    }

    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, jobRepo.countByStatus(s));
        }
        return counts;
    }

    public Map<String, Object> params(Job job) {
        return json.readMap(job.getParamsJson());
    }

    public Map<String, Object> result(Job job) {
        return json.readMap(job.getResultJson());
    }
}
