package com.taskherd.engine.repository;

import com.taskherd.engine.model.QueueEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Storage for the work queue.
 *
 * Leasing is optimistic: a worker picks a few visible candidates, then
 * tries to stamp its lease on one with a conditional UPDATE. Exactly one
 * worker sees "1 row updated" for a given entry and lease window.
 */
public interface QueueEntryRepository extends JpaRepository<QueueEntry, UUID> {

    @Query("""
            SELECT q.id FROM QueueEntry q
            WHERE q.availableAt <= :now
              AND (q.leaseExpiresAt IS NULL OR q.leaseExpiresAt < :now)
            ORDER BY q.availableAt ASC
            """)
    List<UUID> findVisibleIds(@Param("now") Instant now, Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE QueueEntry q
            SET q.leaseOwner = :owner, q.leaseExpiresAt = :expiresAt, q.deliveries = q.deliveries + 1
            WHERE q.id = :id
              AND q.availableAt <= :now
              AND (q.leaseExpiresAt IS NULL OR q.leaseExpiresAt < :now)
            """)
    int tryLease(@Param("id") UUID id,
                 @Param("owner") String owner,
                 @Param("now") Instant now,
                 @Param("expiresAt") Instant expiresAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueueEntry q WHERE q.id = :id AND q.leaseOwner = :owner")
    int deleteOwned(@Param("id") UUID id, @Param("owner") String owner);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE QueueEntry q
            SET q.leaseOwner = NULL, q.leaseExpiresAt = NULL, q.availableAt = :availableAt
            WHERE q.id = :id AND q.leaseOwner = :owner
            """)
    int releaseOwned(@Param("id") UUID id,
                     @Param("owner") String owner,
                     @Param("availableAt") Instant availableAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueueEntry q WHERE q.jobId = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);

    /** Due time of the longest-waiting visible entry, or null when none is waiting. */
    @Query("""
            SELECT MIN(q.availableAt) FROM QueueEntry q
            WHERE q.availableAt <= :now
              AND (q.leaseExpiresAt IS NULL OR q.leaseExpiresAt < :now)
            """)
    Instant findOldestVisibleAvailableAt(@Param("now") Instant now);
}
