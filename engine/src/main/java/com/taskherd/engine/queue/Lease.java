package com.taskherd.engine.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * Exclusive, time-bounded ownership of one queue entry.
 *
 * @param deliveries how many times the entry has been leased, this one included
 */
public record Lease(UUID entryId, UUID jobId, String owner, Instant expiresAt, int deliveries) {

    public boolean isRedelivery() {
        return deliveries > 1;
    }
}
