package com.taskherd.engine.health;

import com.taskherd.engine.queue.WorkQueue;
import com.taskherd.engine.worker.WorkerPool;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Liveness of the queue/worker pair, exposed as {@code /actuator/health/queue}.
 *
 * DOWN when an entry has been waiting longer than
 * {@code taskherd.health.queue-stale-after}: either no worker is leasing,
 * or the workers cannot keep up.
 */
@Component("queue")
public class QueueHealthIndicator implements HealthIndicator {

    private final WorkQueue                  queue;
    private final ObjectProvider<WorkerPool> workers;
    private final Clock                      clock;
    private final Duration                   staleAfter;

    public QueueHealthIndicator(WorkQueue queue,
                                ObjectProvider<WorkerPool> workers,
                                Clock clock,
                                @Value("${taskherd.health.queue-stale-after:PT5M}") Duration staleAfter) {
        this.queue      = queue;
        this.workers    = workers;
        this.clock      = clock;
        this.staleAfter = staleAfter;
    }

    @Override
    public Health health() {
        Instant now = clock.instant();
        Optional<Instant> oldest = queue.oldestWaiting(now);
        WorkerPool pool = workers.getIfAvailable();
        Duration waited = oldest.map(t -> Duration.between(t, now)).orElse(Duration.ZERO);

        Health.Builder builder = waited.compareTo(staleAfter) > 0 ? Health.down() : Health.up();
        return builder
                .withDetail("depth", queue.depth())
                .withDetail("oldestWaitingSeconds", waited.toSeconds())
                .withDetail("localWorkers", pool != null && pool.isRunning() ? "running" : "off")
                .build();
    }
}
