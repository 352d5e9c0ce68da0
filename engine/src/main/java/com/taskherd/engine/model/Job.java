package com.taskherd.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of scheduled or triggered work bound to a plugin.
 *
 * Created by webhook ingestion, the recurrence scheduler or the dashboard;
 * mutated only through {@code JobService.transition}. Rows are never deleted.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "plugin_name", nullable = false)
    private String pluginName;

    // JSON object; decoded by JobService, never by the entity.
    @Column(name = "params_json", columnDefinition = "TEXT", nullable = false)
    private String paramsJson = "{}";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobOrigin origin = JobOrigin.MANUAL;

    // Unique. Webhook delivery, schedule occurrence, or a random manual key.
    @Column(name = "correlation_key", nullable = false, unique = true, updatable = false)
    private String correlationKey;

    // e.g. "owner/repo#42" or "owner/repo@sha". Null = nothing to report.
    @Column(name = "report_target")
    private String reportTarget;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "error_kind")
    private String errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Diagnostic payload such as captured process output.
    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Null means "run as soon as possible".
    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String pluginName, String paramsJson, String correlationKey,
               JobOrigin origin, int maxAttempts) {
        this.pluginName     = pluginName;
        this.paramsJson     = paramsJson;
        this.correlationKey = correlationKey;
        this.origin         = origin;
        this.maxAttempts    = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()             { return id; }
    public String    getPluginName()     { return pluginName; }
    public String    getParamsJson()     { return paramsJson; }
    public JobOrigin getOrigin()         { return origin; }
    public String    getCorrelationKey() { return correlationKey; }
    public String    getReportTarget()   { return reportTarget; }
    public JobStatus getStatus()         { return status; }
    public int       getAttempts()       { return attempts; }
    public int       getMaxAttempts()    { return maxAttempts; }
    public String    getResultJson()     { return resultJson; }
    public String    getErrorKind()      { return errorKind; }
    public String    getErrorMessage()   { return errorMessage; }
    public String    getErrorDetail()    { return errorDetail; }
    public String    getWorkerId()       { return workerId; }
    public Instant   getCreatedAt()      { return createdAt; }
    public Instant   getScheduledAt()    { return scheduledAt; }
    public Instant   getStartedAt()      { return startedAt; }
    public Instant   getFinishedAt()     { return finishedAt; }
    public Instant   getUpdatedAt()      { return updatedAt; }

    public void setStatus(JobStatus status)            { this.status = status; }
    public void setAttempts(int attempts)              { this.attempts = attempts; }
    public void setReportTarget(String reportTarget)   { this.reportTarget = reportTarget; }
    public void setResultJson(String resultJson)       { this.resultJson = resultJson; }
    public void setErrorKind(String errorKind)         { this.errorKind = errorKind; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setErrorDetail(String errorDetail)     { this.errorDetail = errorDetail; }
    public void setWorkerId(String workerId)           { this.workerId = workerId; }
    public void setCreatedAt(Instant createdAt)        { this.createdAt = createdAt; }
    public void setScheduledAt(Instant scheduledAt)    { this.scheduledAt = scheduledAt; }
    public void setStartedAt(Instant startedAt)        { this.startedAt = startedAt; }
    public void setFinishedAt(Instant finishedAt)      { this.finishedAt = finishedAt; }

    /** When the job first became eligible to run. */
    public Instant dueAt() {
        return scheduledAt != null ? scheduledAt : createdAt;
    }
}
