package com.taskherd.engine.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Occurrence arithmetic for recurrences. Pure: no clock, no store.
 *
 * Occurrences are computed in the half-open window {@code (anchor, now]},
 * oldest first. When more than {@code maxBacklog} fall in the window only
 * the most recent ones are kept and the rest are reported as skipped.
 */
public final class Occurrences {

    /**
     * @param occurrences due occurrences, oldest first, at most maxBacklog of them
     * @param skipped     older due occurrences that were dropped (see {@link #cron} for how far
     *                    back they are enumerated)
     */
    public record Due(List<Instant> occurrences, long skipped) {

        public boolean isEmpty() {
            return occurrences.isEmpty();
        }

        public Instant latest() {
            return occurrences.isEmpty() ? null : occurrences.get(occurrences.size() - 1);
        }
    }

    private Occurrences() {}

    /**
     * Cron occurrences in {@code (anchor, now]}.
     *
     * Only a look-back window ending at {@code now} is walked; it starts at
     * {@code maxBacklog + 1} spacings of the first occurrence and doubles until
     * it holds enough occurrences or reaches the anchor. Occurrences before the
     * window are counted from the spacing observed inside it, so
     * {@code skipped} is exact for regular expressions and an estimate for
     * irregular ones.
     */
    public static Due cron(String expression, ZoneId zone, Instant anchor, Instant now, int maxBacklog) {
        CronExpression cron = CronExpression.parse(expression);
        ZonedDateTime first = cron.next(anchor.atZone(zone));
        if (first == null || first.toInstant().isAfter(now)) {
            return new Due(List.of(), 0);
        }
        ZonedDateTime second = cron.next(first);
        Duration spacing = second == null ? Duration.ofSeconds(1) : Duration.between(first, second);
        if (spacing.isZero() || spacing.isNegative()) {
            spacing = Duration.ofSeconds(1);
        }

        Duration window = spacing.multipliedBy(maxBacklog + 1L);
        while (true) {
            Instant start = now.minus(window);
            if (!start.isAfter(anchor)) {
                Walk walk = walk(cron, anchor.atZone(zone), now, maxBacklog);
                return new Due(List.copyOf(walk.kept), walk.dropped);
            }
            Walk walk = walk(cron, start.atZone(zone), now, maxBacklog);
            long seen = walk.kept.size() + walk.dropped;
            if (walk.kept.size() >= maxBacklog) {
                long before = Duration.between(anchor, start).toMillis() * seen / window.toMillis();
                return new Due(List.copyOf(walk.kept), walk.dropped + before);
            }
            window = window.multipliedBy(2);
        }
    }

    private record Walk(Deque<Instant> kept, long dropped) {}

    /** Occurrences in {@code (from, now]}, keeping the last {@code maxBacklog}. */
    private static Walk walk(CronExpression cron, ZonedDateTime from, Instant now, int maxBacklog) {
        Deque<Instant> kept = new ArrayDeque<>();
        long dropped = 0;
        ZonedDateTime cursor = from;
        while (true) {
            ZonedDateTime next = cron.next(cursor);
            if (next == null || next.toInstant().isAfter(now)) {
                break;
            }
            kept.addLast(next.toInstant());
            if (kept.size() > maxBacklog) {
                kept.removeFirst();
                dropped++;
            }
            cursor = next;
        }
        return new Walk(kept, dropped);
    }

    public static Due interval(Duration period, Instant anchor, Instant now, int maxBacklog) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + period);
        }
        if (!now.isAfter(anchor)) {
            return new Due(List.of(), 0);
        }
        long total = Duration.between(anchor, now).toMillis() / period.toMillis();
        long keep  = Math.min(total, maxBacklog);
        long first = total - keep + 1;

        Instant[] kept = new Instant[(int) keep];
        for (int i = 0; i < keep; i++) {
            kept[i] = anchor.plus(period.multipliedBy(first + i));
        }
        return new Due(List.of(kept), total - keep);
    }
}
