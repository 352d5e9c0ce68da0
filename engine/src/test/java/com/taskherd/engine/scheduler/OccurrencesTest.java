package com.taskherd.engine.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class OccurrencesTest {

    private static final Instant T0  = Instant.parse("2024-01-01T00:00:00Z");
    private static final ZoneId  UTC = ZoneOffset.UTC;

    // ------------------------------------------------------------------
    // interval()
    // ------------------------------------------------------------------

    @Test
    void interval_returnsEveryOccurrenceInWindow_oldestFirst() {
        Occurrences.Due due = Occurrences.interval(Duration.ofMinutes(1), T0, T0.plusSeconds(150), 10);

        assertThat(due.occurrences()).containsExactly(T0.plusSeconds(60), T0.plusSeconds(120));
        assertThat(due.skipped()).isZero();
        assertThat(due.latest()).isEqualTo(T0.plusSeconds(120));
    }

    @Test
    void interval_windowIsExclusiveOfAnchorAndInclusiveOfNow() {
        assertThat(Occurrences.interval(Duration.ofMinutes(1), T0, T0, 10).isEmpty()).isTrue();
        assertThat(Occurrences.interval(Duration.ofMinutes(1), T0, T0.plusSeconds(60), 10).occurrences())
                .containsExactly(T0.plusSeconds(60));
    }

    @Test
    void interval_longOutage_keepsOnlyMostRecentBacklog() {
        Occurrences.Due due = Occurrences.interval(Duration.ofMinutes(1), T0, T0.plus(Duration.ofMinutes(10)), 3);

        assertThat(due.occurrences()).containsExactly(
                T0.plus(Duration.ofMinutes(8)), T0.plus(Duration.ofMinutes(9)), T0.plus(Duration.ofMinutes(10)));
        assertThat(due.skipped()).isEqualTo(7);
    }

    @Test
    void interval_nonPositivePeriod_isRejected() {
        assertThatThrownBy(() -> Occurrences.interval(Duration.ZERO, T0, T0.plusSeconds(5), 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // cron()
    // ------------------------------------------------------------------

    @Test
    void cron_everyFiveMinutes() {
        Occurrences.Due due = Occurrences.cron("0 */5 * * * *", UTC, T0, T0.plus(Duration.ofMinutes(20)), 10);

        assertThat(due.occurrences()).containsExactly(
                T0.plus(Duration.ofMinutes(5)), T0.plus(Duration.ofMinutes(10)),
                T0.plus(Duration.ofMinutes(15)), T0.plus(Duration.ofMinutes(20)));
        assertThat(due.skipped()).isZero();
    }

    @Test
    void cron_backlogBound_dropsOldest() {
        Occurrences.Due due = Occurrences.cron("0 */5 * * * *", UTC, T0, T0.plus(Duration.ofMinutes(20)), 2);

        assertThat(due.occurrences()).containsExactly(
                T0.plus(Duration.ofMinutes(15)), T0.plus(Duration.ofMinutes(20)));
        assertThat(due.skipped()).isEqualTo(2);
    }

    @Test
    void cron_everySecondAfterLongOutage_onlyWalksTheBacklog() {
        Instant now = T0.plus(Duration.ofDays(30));

        Occurrences.Due due = assertTimeout(Duration.ofSeconds(2),
                () -> {
                    return Occurrences.cron("* * * * * *", UTC, T0, now, 10);
                });

        assertThat(due.occurrences()).hasSize(10);
        assertThat(due.occurrences().get(0)).isEqualTo(now.minusSeconds(9));
        assertThat(due.latest()).isEqualTo(now);
        assertThat(due.skipped()).isEqualTo(30L * 24 * 3600 - 10);
    }

    @Test
    void cron_irregularSpacing_stillKeepsTheMostRecent() {
        // weekdays only; 2024-03-01 is a Friday, so its 09:00 is not yet due at midnight
        Occurrences.Due due = Occurrences.cron("0 0 9 * * MON-FRI", UTC, T0,
                Instant.parse("2024-03-01T00:00:00Z"), 3);

        assertThat(due.occurrences()).containsExactly(
                Instant.parse("2024-02-27T09:00:00Z"),
                Instant.parse("2024-02-28T09:00:00Z"),
                Instant.parse("2024-02-29T09:00:00Z"));
        assertThat(due.skipped()).isPositive();
    }

    @Test
    void cron_evaluatedInConfiguredZone() {
        // 03:00 in Berlin is 02:00 UTC in winter
        Occurrences.Due due = Occurrences.cron("0 0 3 * * *", ZoneId.of("Europe/Berlin"),
                T0, T0.plus(Duration.ofDays(1)), 10);

        assertThat(due.occurrences()).containsExactly(Instant.parse("2024-01-01T02:00:00Z"));
    }

    @Test
    void cron_nothingDue_isEmpty() {
        Occurrences.Due due = Occurrences.cron("0 0 3 * * *", UTC, T0, T0.plus(Duration.ofHours(1)), 10);

        assertThat(due.isEmpty()).isTrue();
        assertThat(due.latest()).isNull();
    }
}
