package com.taskherd.engine.report;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.ReportStatus;
import com.taskherd.engine.model.ReportTask;
import com.taskherd.engine.repository.ReportTaskRepository;
import com.taskherd.engine.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Owns ReportTasks: creation when a job ends, one delivery attempt at a
 * time, and the operator retry.
 *
 * Delivery state never feeds back into the job. A report that exhausts its
 * attempts is marked FAILED and left for an operator; the job it describes
 * stays exactly as it was.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private static final int LIST_LIMIT = 200;

    private final ReportTaskRepository reportRepo;
    private final ReportRenderer       renderer;
    private final HostClient           host;
    private final RetryPolicy          retryPolicy;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;

    public ReportService(ReportTaskRepository reportRepo,
                         ReportRenderer renderer,
                         HostClient host,
                         TaskherdProperties props,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.reportRepo    = reportRepo;
        this.renderer      = renderer;
        this.host          = host;
        this.retryPolicy   = RetryPolicy.from(props.reporter());
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * Create the report for a job that just reached a terminal state.
     * Runs inside the transition's transaction; at most one per job.
     */
    @Transactional
    public void createFor(Job job) {
        if (job.getReportTarget() == null || reportRepo.existsByJobId(job.getId())) {
            return;
        }
        ReportTask task = new ReportTask(job.getId(), job.getReportTarget(), renderer.render(job), clock.instant());
        reportRepo.save(task);
        log.info("Queued {} report for job {} to {}", job.getStatus(), job.getId(), job.getReportTarget());
    }

    /**
     * Make one delivery attempt.
     *
     * @return DELIVERED, PENDING (will be retried later) or FAILED (gave up)
     */
    public ReportStatus attempt(ReportTask task) {
        try {
            host.postComment(TargetRef.parse(task.getTarget()), task.getMessage());
        } catch (IllegalArgumentException e) {
            return recordFailure(task, new DeliveryException(e.getMessage(), false, e));
        } catch (DeliveryException e) {
            return recordFailure(task, e);
        }

        task.incrementAttempts();
        task.setStatus(ReportStatus.DELIVERED);
        task.setDeliveredAt(clock.instant());
        task.setLastError(null);
        reportRepo.save(task);
        log.info("Delivered report for job {} to {} (attempt {})", task.getJobId(), task.getTarget(), task.getAttempts());
        meterRegistry.counter("taskherd.reports.delivery", "outcome", "delivered").increment();
        return ReportStatus.DELIVERED;
    }

    private ReportStatus recordFailure(ReportTask task, DeliveryException e) {
        task.incrementAttempts();
        task.setLastError(e.getMessage());
        int attempts = task.getAttempts();

        if (e.isRetryable() && retryPolicy.canRetry(attempts)) {
            Duration delay = retryPolicy.delayAfter(attempts);
            task.setNextAttemptAt(clock.instant().plus(delay));
            reportRepo.save(task);
            log.warn("Report for job {} failed (attempt {}/{}): {}; next try in {}",
                    task.getJobId(), attempts, retryPolicy.maxAttempts(), e.getMessage(), delay);
            meterRegistry.counter("taskherd.reports.delivery", "outcome", "retried").increment();
            return ReportStatus.PENDING;
        }

        task.setStatus(ReportStatus.FAILED);
        reportRepo.save(task);
        log.error("Report for job {} to {} failed permanently after {} attempt(s): {}",
                task.getJobId(), task.getTarget(), attempts, e.getMessage());
        meterRegistry.counter("taskherd.reports.delivery", "outcome", "failed").increment();
        return ReportStatus.FAILED;
    }

    /** Put a FAILED report back in line with a fresh attempt budget. */
    @Transactional
    public ReportTask retry(UUID id) {
        ReportTask task = reportRepo.findById(id).orElseThrow(() -> new ReportNotFoundException(id));
        if (task.getStatus() != ReportStatus.FAILED) {
            throw new ReportStateException(id, task.getStatus());
        }
        task.setStatus(ReportStatus.PENDING);
        task.resetAttempts();
        task.setNextAttemptAt(clock.instant());
        log.info("Report {} for job {} queued for redelivery", id, task.getJobId());
        return reportRepo.save(task);
    }

    @Transactional(readOnly = true)
    public List<ReportTask> list(ReportStatus status) {
        return status != null
                ? reportRepo.findByStatusOrderByCreatedAtDesc(status)
                : reportRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, LIST_LIMIT));
    }

    @Transactional(readOnly = true)
    public List<ReportTask> findDue(Instant now, int limit) {
        return reportRepo.findDue(now, PageRequest.of(0, limit));
    }

    /** Claim a due task for this node; false if another node got it. */
    public boolean claim(ReportTask task, Instant now, Duration hold) {
        return reportRepo.claim(task.getId(), now, now.plus(hold)) == 1;
    }
}
