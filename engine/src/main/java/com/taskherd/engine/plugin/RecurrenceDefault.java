package com.taskherd.engine.plugin;

import java.time.Duration;

/**
 * Default recurrence a plugin asks for. Exactly one of the two is set.
 *
 * @param cron     Spring six-field cron expression, e.g. "0 0 3 * * *"
 * @param interval fixed period between occurrences
 */
public record RecurrenceDefault(String cron, Duration interval) {

    public static RecurrenceDefault cron(String expression) {
        return new RecurrenceDefault(expression, null);
    }

    public static RecurrenceDefault every(Duration interval) {
        return new RecurrenceDefault(null, interval);
    }
}
