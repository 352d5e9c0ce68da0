package com.taskherd.engine.repository;

import com.taskherd.engine.model.ReportStatus;
import com.taskherd.engine.model.ReportTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReportTaskRepository extends JpaRepository<ReportTask, UUID> {

    Optional<ReportTask> findByJobId(UUID jobId);

    boolean existsByJobId(UUID jobId);

    List<ReportTask> findByStatusOrderByCreatedAtDesc(ReportStatus status);

    List<ReportTask> findAllByOrderByCreatedAtDesc(Pageable page);

    @Query("""
            SELECT r FROM ReportTask r
            WHERE r.status = com.taskherd.engine.model.ReportStatus.PENDING
              AND r.nextAttemptAt <= :now
            ORDER BY r.nextAttemptAt ASC
            """)
    List<ReportTask> findDue(@Param("now") Instant now, Pageable page);

    /**
     * Claim a due task by pushing its next_attempt_at out to {@code claimUntil}.
     * Returns 0 if another reporter instance got there first.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ReportTask r SET r.nextAttemptAt = :claimUntil
            WHERE r.id = :id
              AND r.status = com.taskherd.engine.model.ReportStatus.PENDING
              AND r.nextAttemptAt <= :now
            """)
    int claim(@Param("id") UUID id, @Param("now") Instant now, @Param("claimUntil") Instant claimUntil);
}
