package com.taskherd.engine.repository;

import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Dashboard filtering goes through {@link JpaSpecificationExecutor} so that
 * absent filters never turn into typed NULL parameters.
 */
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    Optional<Job> findByCorrelationKey(String correlationKey);

    /**
     * Row-locked read used by every state transition. The lock is held until
     * the surrounding transaction commits, so the status check and the write
     * that follows form one compare-and-set.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    List<Job> findByStatus(JobStatus status);

    /**
     * PENDING jobs that have been leasable since before {@code cutoff}: both
     * created and due before it. A backfilled occurrence carries an old
     * scheduled time but only becomes leasable when it is created.
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.taskherd.engine.model.JobStatus.PENDING
              AND j.createdAt < :cutoff
              AND (j.scheduledAt IS NULL OR j.scheduledAt < :cutoff)
            """)
    List<Job> findPendingDueBefore(@Param("cutoff") Instant cutoff);

    long countByStatus(JobStatus status);
}
