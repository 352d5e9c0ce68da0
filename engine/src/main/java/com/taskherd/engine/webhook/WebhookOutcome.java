package com.taskherd.engine.webhook;

import java.util.List;
import java.util.UUID;

/**
 * Result of an accepted webhook delivery.
 *
 * @param jobIds jobs created or, for a redelivery, found already existing; empty
 *               for events no rule maps
 */
public record WebhookOutcome(boolean accepted, List<UUID> jobIds) {

    public static WebhookOutcome accepted(List<UUID> jobIds) {
        return new WebhookOutcome(true, List.copyOf(jobIds));
    }
}
