package com.taskherd.engine.worker;

import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class RunningJobsTest {

    private final RunningJobs running = new RunningJobs();

    @Test
    void signal_setsFlagAndCancelsFuture() {
        UUID id = UUID.randomUUID();
        CompletableFuture<Object> future = new CompletableFuture<>();
        AtomicBoolean cancelled = new AtomicBoolean();
        running.register(id, future, cancelled);

        assertThat(running.isRunning(id)).isTrue();
        assertThat(running.signal(id)).isTrue();
        assertThat(cancelled).isTrue();
        assertThat(future.isCancelled()).isTrue();
    }

    @Test
    void signal_unknownOrRemovedJob_returnsFalse() {
        UUID id = UUID.randomUUID();
        running.register(id, new CompletableFuture<>(), new AtomicBoolean());
        running.remove(id);

        assertThat(running.isRunning(id)).isFalse();
        assertThat(running.signal(id)).isFalse();
        assertThat(running.signal(UUID.randomUUID())).isFalse();
    }
}
