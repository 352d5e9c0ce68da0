package com.taskherd.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Outbound notification of a terminal Job to the external host.
 *
 * Owned by the result reporter. Its delivery state is independent of the
 * job's: a FAILED report never reopens the job.
 *
 * DB table: report_tasks
 */
@Entity
@Table(name = "report_tasks")
public class ReportTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // One report per job.
    @Column(name = "job_id", nullable = false, unique = true, updatable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String target;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReportStatus status = ReportStatus.PENDING;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    protected ReportTask() {}   // required by JPA

    public ReportTask(UUID jobId, String target, String message, Instant nextAttemptAt) {
        this.jobId         = jobId;
        this.target        = target;
        this.message       = message;
        this.nextAttemptAt = nextAttemptAt;
    }

    public UUID         getId()            { return id; }
    public UUID         getJobId()         { return jobId; }
    public String       getTarget()        { return target; }
    public String       getMessage()       { return message; }
    public ReportStatus getStatus()        { return status; }
    public int          getAttempts()      { return attempts; }
    public Instant      getNextAttemptAt() { return nextAttemptAt; }
    public String       getLastError()     { return lastError; }
    public Instant      getCreatedAt()     { return createdAt; }
    public Instant      getDeliveredAt()   { return deliveredAt; }

    public void setStatus(ReportStatus status)         { this.status = status; }
    public void setNextAttemptAt(Instant t)            { this.nextAttemptAt = t; }
    public void setLastError(String lastError)         { this.lastError = lastError; }
    public void setDeliveredAt(Instant t)              { this.deliveredAt = t; }
    public void incrementAttempts()                    { this.attempts++; }
    public void resetAttempts()                        { this.attempts = 0; }
}
