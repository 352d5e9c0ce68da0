package com.taskherd.engine.repository;

import com.taskherd.engine.model.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    Optional<Schedule> findByName(String name);

    List<Schedule> findByEnabledTrueOrderByNameAsc();

    List<Schedule> findAllByOrderByNameAsc();

    /**
     * Move last_enqueued forward to {@code occurrence}. A no-op (returns 0)
     * when another scheduler instance has already advanced it as far or
     * further, so the value can never go backwards.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Schedule s SET s.lastEnqueued = :occurrence
            WHERE s.id = :id
              AND (s.lastEnqueued IS NULL OR s.lastEnqueued < :occurrence)
            """)
    int advanceLastEnqueued(@Param("id") UUID id, @Param("occurrence") Instant occurrence);
}
