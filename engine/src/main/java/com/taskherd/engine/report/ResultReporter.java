package com.taskherd.engine.report;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.ReportTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Polls for due report tasks and delivers them.
 *
 * Runs on its own scheduler thread and blocks only on its own HTTP calls,
 * never on job execution. A claimed task is hidden from other nodes for
 * twice the HTTP timeout; if this node dies mid-delivery the task simply
 * becomes due again.
 */
@Component
@ConditionalOnProperty(prefix = "taskherd.reporter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ResultReporter {

    private static final Logger log = LoggerFactory.getLogger(ResultReporter.class);

    private final ReportService reports;
    private final Clock         clock;
    private final int           batchSize;
    private final Duration      hold;

    public ResultReporter(ReportService reports, TaskherdProperties props, Clock clock) {
        this.reports   = reports;
        this.clock     = clock;
        this.batchSize = props.reporter().batchSize();
        this.hold      = props.github().timeout().multipliedBy(2);
    }

    /** @return number of tasks attempted this round */
    @Scheduled(fixedDelayString = "${taskherd.reporter.poll-interval:PT5S}",
               initialDelayString = "${taskherd.reporter.initial-delay:PT10S}")
    public int deliverDue() {
        Instant now = clock.instant();
        List<ReportTask> due = reports.findDue(now, batchSize);
        int attempted = 0;
        for (ReportTask task : due) {
            try {
                if (!reports.claim(task, now, hold)) {
                    continue;
                }
                reports.attempt(task);
                attempted++;
            } catch (RuntimeException e) {
                log.error("Report {} for job {} could not be processed: {}",
                        task.getId(), task.getJobId(), e.getMessage(), e);
            }
        }
        return attempted;
    }
}
