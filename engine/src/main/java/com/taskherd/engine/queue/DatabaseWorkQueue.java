package com.taskherd.engine.queue;

import com.taskherd.engine.model.QueueEntry;
import com.taskherd.engine.repository.QueueEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link WorkQueue} backed by the queue_entries table.
 *
 * The DB is the queue: enqueueing joins the caller's transaction, so a job
 * row and its first queue entry commit together. Leasing picks a handful of
 * visible candidates and claims the first one whose conditional UPDATE
 * succeeds; losing a race on one candidate just moves on to the next.
 */
@Component
public class DatabaseWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(DatabaseWorkQueue.class);

    // Candidates fetched per lease attempt; > 1 so racing workers rarely come back empty.
    private static final int CANDIDATES = 5;

    private final QueueEntryRepository repo;
    private final Clock                clock;

    public DatabaseWorkQueue(QueueEntryRepository repo, Clock clock) {
        this.repo  = repo;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void enqueue(UUID jobId, Instant availableAt) {
        repo.save(new QueueEntry(jobId, availableAt));
        log.debug("Enqueued job {} available at {}", jobId, availableAt);
    }

    @Override
    @Transactional
    public Optional<Lease> lease(String owner, Duration visibility) {
        Instant now = clock.instant();
        List<UUID> candidates = repo.findVisibleIds(now, PageRequest.of(0, CANDIDATES));
        for (UUID id : candidates) {
            if (repo.tryLease(id, owner, now, now.plus(visibility)) == 1) {
                QueueEntry e = repo.findById(id).orElseThrow();
                return Optional.of(new Lease(e.getId(), e.getJobId(), owner,
                        e.getLeaseExpiresAt(), e.getDeliveries()));
            }
        }
        return Optional.empty();
    }

    @Override
    @Transactional
    public boolean ack(Lease lease) {
        boolean removed = repo.deleteOwned(lease.entryId(), lease.owner()) == 1;
        if (!removed) {
            log.debug("Ack for entry {} (job {}) found no owned entry; lease lost or entry discarded",
                    lease.entryId(), lease.jobId());
        }
        return removed;
    }

    @Override
    @Transactional
    public boolean release(Lease lease, Instant availableAt) {
        return repo.releaseOwned(lease.entryId(), lease.owner(), availableAt) == 1;
    }

    @Override
    @Transactional
    public int discard(UUID jobId) {
        return repo.deleteByJobId(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public long depth() {
        return repo.count();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> oldestWaiting(Instant now) {
        return Optional.ofNullable(repo.findOldestVisibleAvailableAt(now));
    }
}
