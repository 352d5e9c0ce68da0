package com.taskherd.engine.scheduler;

import com.taskherd.engine.IntegrationTestSupport;
import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Schedule;
import com.taskherd.engine.repository.ScheduleRepository;
import com.taskherd.engine.service.JobService;
import com.taskherd.engine.service.JsonColumns;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives RecurrenceScheduler by hand against the real store. The scheduled
 * bean itself is disabled in tests, so each test builds its own instance.
 */
class RecurrenceSchedulerIntegrationTest extends IntegrationTestSupport {

    @Autowired ScheduleService    scheduleService;
    @Autowired ScheduleRepository scheduleRepo;
    @Autowired JobService         jobService;
    @Autowired JsonColumns        json;
    @Autowired TaskherdProperties props;

    RecurrenceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RecurrenceScheduler(scheduleRepo, jobService, json, props, new SimpleMeterRegistry(), clock);
    }

    @Test
    void tick_enqueuesEachDueOccurrenceOnce() {
        scheduleService.create("every-minute", "echo", Map.of("x", "tick"), null, 60L);
        clock.advance(Duration.ofSeconds(181));

        scheduler.tick();

        assertThat(count("SELECT COUNT(*) FROM jobs WHERE origin = 'SCHEDULE'")).isEqualTo(3);
        assertThat(count("SELECT COUNT(*) FROM queue_entries")).isEqualTo(3);
        Schedule s = scheduleRepo.findByName("every-minute").orElseThrow();
        assertThat(s.getLastEnqueued()).isEqualTo(s.getCreatedAt().plusSeconds(180));

        // Nothing new is due yet
        scheduler.tick();
        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(3);
    }

    @Test
    void crashBeforeAdvancing_replayCreatesNoDuplicates() {
        scheduleService.create("replayed", "echo", Map.of(), null, 60L);
        clock.advance(Duration.ofSeconds(150));
        scheduler.tick();
        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(2);

        // Jobs were written but the schedule never recorded it
        jdbc.update("UPDATE schedules SET last_enqueued = NULL WHERE name = 'replayed'");
        scheduler.tick();

        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(2);
        assertThat(count("SELECT COUNT(*) FROM queue_entries")).isEqualTo(2);

        clock.advance(Duration.ofSeconds(60));
        scheduler.tick();
        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(3);
    }

    @Test
    void longOutage_enqueuesAtMostTheBacklogBound() {
        scheduleService.create("behind", "echo", Map.of(), null, 60L);
        clock.advance(Duration.ofMinutes(30).plusSeconds(1));

        scheduler.tick();

        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(props.scheduler().maxBacklog());
        Schedule s = scheduleRepo.findByName("behind").orElseThrow();
        assertThat(s.getLastEnqueued()).isEqualTo(s.getCreatedAt().plus(Duration.ofMinutes(30)));
    }

    @Test
    void disabledSchedule_isNotFired() {
        scheduleService.create("paused", "echo", Map.of(), null, 60L);
        scheduleService.setEnabled("paused", false);
        clock.advance(Duration.ofMinutes(5));

        scheduler.tick();

        assertThat(count("SELECT COUNT(*) FROM jobs")).isZero();
    }

    @Test
    void jobsCarryOccurrenceAsScheduledTime() {
        scheduleService.create("stamped", "echo", Map.of(), null, 60L);
        clock.advance(Duration.ofSeconds(61));

        scheduler.tick();

        Schedule s = scheduleRepo.findByName("stamped").orElseThrow();
        List<String> keys = jdbc.queryForList("SELECT correlation_key FROM jobs", String.class);
        assertThat(keys).containsExactly(
                RecurrenceScheduler.correlationKey("stamped", s.getCreatedAt().plusSeconds(60)));
    }
}
