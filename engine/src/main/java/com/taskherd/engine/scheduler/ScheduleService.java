package com.taskherd.engine.scheduler;

import com.taskherd.engine.model.Schedule;
import com.taskherd.engine.plugin.InvalidParametersException;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.PluginNotFoundException;
import com.taskherd.engine.plugin.PluginRegistry;
import com.taskherd.engine.plugin.RecurrenceDefault;
import com.taskherd.engine.repository.ScheduleRepository;
import com.taskherd.engine.service.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Standing schedules: definition, validation and enable/disable.
 *
 * A plugin whose manifest declares a default recurrence gets a schedule
 * named after the plugin when the application starts, unless one with that
 * name already exists.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepo;
    private final PluginRegistry     registry;
    private final JsonColumns        json;
    private final Clock              clock;

    public ScheduleService(ScheduleRepository scheduleRepo,
                           PluginRegistry registry,
                           JsonColumns json,
                           Clock clock) {
        this.scheduleRepo = scheduleRepo;
        this.registry     = registry;
        this.json         = json;
        this.clock        = clock;
    }

    /**
     * Define a new schedule. Exactly one of {@code cron} (Spring six-field
     * syntax) and {@code intervalSeconds} must be given.
     *
     * @throws InvalidScheduleException if the definition is rejected
     */
    @Transactional
    public Schedule create(String name, String pluginName, Map<String, Object> params,
                           String cron, Long intervalSeconds) {
        if (name == null || name.isBlank()) {
            throw new InvalidScheduleException("schedule name is required");
        }
        boolean hasCron = cron != null && !cron.isBlank();
        if (hasCron == (intervalSeconds != null)) {
            throw new InvalidScheduleException("exactly one of cron or intervalSeconds is required");
        }
        if (hasCron && !CronExpression.isValidExpression(cron)) {
            throw new InvalidScheduleException("invalid cron expression '" + cron + "'");
        }
        if (intervalSeconds != null && intervalSeconds <= 0) {
            throw new InvalidScheduleException("intervalSeconds must be positive");
        }
        Map<String, Object> merged;
        try {
            merged = registry.applySchema(pluginName, params);
        } catch (PluginNotFoundException | InvalidParametersException e) {
            throw new InvalidScheduleException(e.getMessage());
        }
        if (scheduleRepo.findByName(name).isPresent()) {
            throw new InvalidScheduleException("schedule '" + name + "' already exists");
        }

        Schedule s = new Schedule(name, pluginName, json.write(merged), hasCron ? cron : null, intervalSeconds);
        s.setCreatedAt(clock.instant());
        s = scheduleRepo.save(s);
        log.info("Created schedule '{}' for plugin '{}' ({})", name, pluginName,
                hasCron ? "cron " + cron : "every " + intervalSeconds + "s");
        return s;
    }

    @Transactional(readOnly = true)
    public List<Schedule> list() {
        return scheduleRepo.findAllByOrderByNameAsc();
    }

    @Transactional
    public Schedule setEnabled(String name, boolean enabled) {
        Schedule s = scheduleRepo.findByName(name).orElseThrow(() -> new ScheduleNotFoundException(name));
        s.setEnabled(enabled);
        log.info("Schedule '{}' {}", name, enabled ? "enabled" : "disabled");
        return scheduleRepo.save(s);
    }

    // ------------------------------------------------------------------
    // Plugin default recurrences
    // ------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void registerPluginDefaults() {
        for (PluginManifest m : registry.list()) {
            RecurrenceDefault r = m.recurrence();
            if (r == null || scheduleRepo.findByName(m.name()).isPresent()) {
                continue;
            }
            Long seconds = r.interval() != null ? Math.max(1, r.interval().toSeconds()) : null;
            try {
                create(m.name(), m.name(), Map.of(), r.cron(), seconds);
            } catch (InvalidScheduleException | DataIntegrityViolationException e) {
                // Another node created it first, or the defaults need params the plugin didn't default.
                log.warn("Default schedule for plugin '{}' not created: {}", m.name(), e.getMessage());
            }
        }
    }
}
