package com.taskherd.engine.worker;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.queue.Lease;
import com.taskherd.engine.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of lease loops pulling from the {@link WorkQueue}.
 *
 * Each loop leases one entry, runs it through {@link JobRunner}, and goes
 * straight back for the next. An empty queue makes the loop sleep, starting
 * at {@code poll-interval} and doubling up to {@code max-poll-interval}.
 *
 * The DB is the queue, so any number of nodes can run a pool side by side.
 */
@Component
@ConditionalOnProperty(prefix = "taskherd.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkQueue                 queue;
    private final JobRunner                 runner;
    private final TaskherdProperties.Worker cfg;
    private final String                    nodeId = UUID.randomUUID().toString().substring(0, 8);

    private volatile boolean running = false;
    private ExecutorService  loops;

    public WorkerPool(WorkQueue queue, JobRunner runner, TaskherdProperties props) {
        this.queue  = queue;
        this.runner = runner;
        this.cfg    = props.worker();
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;
        AtomicInteger seq = new AtomicInteger();
        loops = Executors.newFixedThreadPool(cfg.threads(),
                r -> new Thread(r, "taskherd-worker-" + seq.incrementAndGet()));
        for (int i = 1; i <= cfg.threads(); i++) {
            String owner = "worker-" + nodeId + "-" + i;
            loops.submit(() -> loop(owner));
        }
        log.info("Worker pool started: {} thread(s), node {}", cfg.threads(), nodeId);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        loops.shutdownNow();
        try {
            if (!loops.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Worker pool stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Lease loop
    // ------------------------------------------------------------------

    private void loop(String owner) {
        Duration idle = cfg.pollInterval();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<Lease> lease = queue.lease(owner, cfg.leaseVisibility());
                if (lease.isPresent()) {
                    runner.run(lease.get());
                    idle = cfg.pollInterval();
                    continue;
                }
                Thread.sleep(idle.toMillis());
                idle = nextIdle(idle, cfg.maxPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                // One bad job or a DB hiccup must not kill the loop.
                log.error("Worker {} iteration failed: {}", owner, e.getMessage(), e);
                try {
                    Thread.sleep(cfg.pollInterval().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.debug("Worker {} exiting", owner);
    }

    static Duration nextIdle(Duration current, Duration max) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(max) > 0 ? max : doubled;
    }
}
