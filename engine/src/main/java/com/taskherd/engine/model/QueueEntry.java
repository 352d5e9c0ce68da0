package com.taskherd.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One deliverable message in the work queue: "job X is ready to run".
 *
 * An entry is visible when {@code availableAt <= now} and it is not under an
 * unexpired lease. Acknowledging deletes it; a lapsed lease simply makes it
 * visible again, which is what gives at-least-once delivery.
 *
 * DB table: queue_entries
 */
@Entity
@Table(name = "queue_entries")
public class QueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    // Number of times the entry has been leased.
    @Column(nullable = false)
    private int deliveries = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected QueueEntry() {}   // required by JPA

    public QueueEntry(UUID jobId, Instant availableAt) {
        this.jobId       = jobId;
        this.availableAt = availableAt;
    }

    public UUID    getId()             { return id; }
    public UUID    getJobId()          { return jobId; }
    public Instant getAvailableAt()    { return availableAt; }
    public String  getLeaseOwner()     { return leaseOwner; }
    public Instant getLeaseExpiresAt() { return leaseExpiresAt; }
    public int     getDeliveries()     { return deliveries; }
    public Instant getCreatedAt()      { return createdAt; }
}
