package com.taskherd.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A standing recurrence: run {@code pluginName} with fixed params on a cron
 * expression or a fixed interval.
 *
 * {@code lastEnqueued} is the occurrence timestamp of the newest job created
 * for this schedule. It only ever moves forward (see
 * {@code ScheduleRepository.advanceLastEnqueued}).
 *
 * DB table: schedules
 */
@Entity
@Table(name = "schedules")
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false)
    private String name;

    @Column(name = "plugin_name", nullable = false)
    private String pluginName;

    @Column(name = "params_json", columnDefinition = "TEXT", nullable = false)
    private String paramsJson = "{}";

    // Exactly one of cronExpression / intervalSeconds is set.
    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "last_enqueued")
    private Instant lastEnqueued;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Schedule() {}   // required by JPA

    public Schedule(String name, String pluginName, String paramsJson,
                    String cronExpression, Long intervalSeconds) {
        this.name            = name;
        this.pluginName      = pluginName;
        this.paramsJson      = paramsJson;
        this.cronExpression  = cronExpression;
        this.intervalSeconds = intervalSeconds;
    }

    public UUID    getId()              { return id; }
    public String  getName()            { return name; }
    public String  getPluginName()      { return pluginName; }
    public String  getParamsJson()      { return paramsJson; }
    public String  getCronExpression()  { return cronExpression; }
    public Long    getIntervalSeconds() { return intervalSeconds; }
    public boolean isEnabled()          { return enabled; }
    public Instant getLastEnqueued()    { return lastEnqueued; }
    public Instant getCreatedAt()       { return createdAt; }

    public void setEnabled(boolean enabled)          { this.enabled = enabled; }
    public void setCreatedAt(Instant createdAt)      { this.createdAt = createdAt; }
    public void setLastEnqueued(Instant lastEnqueued) { this.lastEnqueued = lastEnqueued; }

    /** Lower bound (exclusive) for the next occurrence search. */
    public Instant anchor() {
        return lastEnqueued != null ? lastEnqueued : createdAt;
    }
}
