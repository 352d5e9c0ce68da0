package com.taskherd.engine.health;

import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.worker.WorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock WorkQueue                  queue;
    @Mock ObjectProvider<WorkerPool> workers;

    private QueueHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new QueueHealthIndicator(queue, workers, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));
    }

    @Test
    void emptyQueue_isUp() {
        when(queue.oldestWaiting(NOW)).thenReturn(Optional.empty());
        when(queue.depth()).thenReturn(0L);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("depth", 0L).containsEntry("localWorkers", "off");
    }

    @Test
    void entryWaitingPastThreshold_isDown() {
        when(queue.oldestWaiting(NOW)).thenReturn(Optional.of(NOW.minus(Duration.ofMinutes(7))));
        when(queue.depth()).thenReturn(12L);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("oldestWaitingSeconds", 420L);
    }

    @Test
    void recentBacklog_isStillUp() {
        when(queue.oldestWaiting(NOW)).thenReturn(Optional.of(NOW.minusSeconds(30)));
        when(queue.depth()).thenReturn(3L);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
