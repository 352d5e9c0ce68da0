package com.taskherd.engine.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, at-least-once delivery of "job X is ready" messages.
 *
 * A leased entry stays invisible until the lease expires. If the holder
 * never acknowledges it (crash, kill -9) it becomes visible again and is
 * delivered to another worker. The core never adds its own locking on top.
 */
public interface WorkQueue {

    /** Make {@code jobId} deliverable at or after {@code availableAt}. */
    void enqueue(UUID jobId, Instant availableAt);

    /** Lease the oldest visible entry, if any. Never blocks. */
    Optional<Lease> lease(String owner, Duration visibility);

    /** Remove a leased entry. Returns false if the lease was lost in the meantime. */
    boolean ack(Lease lease);

    /** Give a leased entry back, visible again at {@code availableAt}. */
    boolean release(Lease lease, Instant availableAt);

    /** Drop every entry for a job (used before re-enqueueing a retry). */
    int discard(UUID jobId);

    long depth();

    /** Due time of the longest-waiting visible entry. */
    Optional<Instant> oldestWaiting(Instant now);
}
