package com.taskherd.engine.scheduler;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.JobOrigin;
import com.taskherd.engine.model.Schedule;
import com.taskherd.engine.repository.ScheduleRepository;
import com.taskherd.engine.service.JobRequest;
import com.taskherd.engine.service.JobService;
import com.taskherd.engine.service.JsonColumns;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

/**
 * Timer loop turning due schedule occurrences into jobs.
 *
 * Each tick recomputes, per enabled schedule, the occurrences due since
 * {@code last_enqueued} straight from the store, creates one job per
 * occurrence, then advances {@code last_enqueued}. Nothing is kept in
 * memory between ticks. A crash between creating the jobs and advancing
 * the marker just means the next tick sees the same occurrences again; the
 * correlation key {@code schedule:<name>@<occurrence>} turns those repeats
 * into no-ops.
 *
 * Run it on one node ({@code taskherd.scheduler.enabled}); a second
 * instance is harmless, only wasteful.
 */
@Component
@ConditionalOnProperty(prefix = "taskherd.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecurrenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceScheduler.class);

    private final ScheduleRepository scheduleRepo;
    private final JobService         jobService;
    private final JsonColumns        json;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;
    private final ZoneId             zone;
    private final int                maxBacklog;

    public RecurrenceScheduler(ScheduleRepository scheduleRepo,
                               JobService jobService,
                               JsonColumns json,
                               TaskherdProperties props,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.scheduleRepo  = scheduleRepo;
        this.jobService    = jobService;
        this.json          = json;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.zone          = ZoneId.of(props.scheduler().zone());
        this.maxBacklog    = props.scheduler().maxBacklog();
    }

    @Scheduled(fixedDelayString = "${taskherd.scheduler.tick-interval:PT30S}",
               initialDelayString = "${taskherd.scheduler.initial-delay:PT5S}")
    public void tick() {
        Instant now = clock.instant();
        for (Schedule schedule : scheduleRepo.findByEnabledTrueOrderByNameAsc()) {
            try {
                fire(schedule, now);
            } catch (RuntimeException e) {
                log.error("Schedule '{}' failed this tick: {}", schedule.getName(), e.getMessage(), e);
            }
        }
    }

    /** @return number of occurrences handed to the store (new or already present) */
    int fire(Schedule schedule, Instant now) {
        Occurrences.Due due = schedule.getCronExpression() != null
                ? Occurrences.cron(schedule.getCronExpression(), zone, schedule.anchor(), now, maxBacklog)
                : Occurrences.interval(Duration.ofSeconds(schedule.getIntervalSeconds()),
                                       schedule.anchor(), now, maxBacklog);
        if (due.isEmpty()) {
            return 0;
        }
        if (due.skipped() > 0) {
            log.warn("Schedule '{}' is {} occurrence(s) behind; skipping the oldest {} and keeping {}",
                    schedule.getName(), due.skipped() + due.occurrences().size(),
                    due.skipped(), due.occurrences().size());
        }

        Map<String, Object> params = json.readMap(schedule.getParamsJson());
        for (Instant occurrence : due.occurrences()) {
            jobService.createJob(new JobRequest(schedule.getPluginName(), params, occurrence,
                    correlationKey(schedule.getName(), occurrence), JobOrigin.SCHEDULE, null));
            meterRegistry.counter("taskherd.scheduler.enqueued", "schedule", schedule.getName()).increment();
        }

        scheduleRepo.advanceLastEnqueued(schedule.getId(), due.latest());
        log.debug("Schedule '{}' advanced to {}", schedule.getName(), due.latest());
        return due.occurrences().size();
    }

    static String correlationKey(String scheduleName, Instant occurrence) {
        return "schedule:" + scheduleName + "@" + occurrence;
    }
}
