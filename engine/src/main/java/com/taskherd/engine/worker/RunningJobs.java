package com.taskherd.engine.worker;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Plugin executions in flight on this node, so a cancel request can reach them.
 */
@Component
public class RunningJobs {

    private record Execution(Future<?> future, AtomicBoolean cancelled) {}

    private final Map<UUID, Execution> executions = new ConcurrentHashMap<>();

    /** Track an execution; the returned flag backs {@code PluginContext.isCancelled()}. */
    public void register(UUID jobId, Future<?> future, AtomicBoolean cancelled) {
        executions.put(jobId, new Execution(future, cancelled));
    }

    /**
     * Raise the cancellation flag and interrupt the plugin thread.
     *
     * @return false if the job is not executing on this node
     */
    public boolean signal(UUID jobId) {
        Execution e = executions.get(jobId);
        if (e == null) {
            return false;
        }
        e.cancelled().set(true);
        e.future().cancel(true);
        return true;
    }

    public void remove(UUID jobId) {
        executions.remove(jobId);
    }

    public boolean isRunning(UUID jobId) {
        return executions.containsKey(jobId);
    }
}
