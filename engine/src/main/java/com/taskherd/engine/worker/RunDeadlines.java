package com.taskherd.engine.worker;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.plugin.PluginRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * When a RUNNING job is considered stuck: start time plus the plugin's
 * timeout plus the reaper grace period.
 */
@Component
public class RunDeadlines {

    private final PluginRegistry     registry;
    private final Duration           defaultTimeout;
    private final Duration           grace;

    public RunDeadlines(PluginRegistry registry, TaskherdProperties props) {
        this.registry       = registry;
        this.defaultTimeout = props.worker().defaultTimeout();
        this.grace          = props.reaper().grace();
    }

    public Duration timeoutFor(String pluginName) {
        return registry.contains(pluginName) ? registry.timeoutFor(pluginName, defaultTimeout) : defaultTimeout;
    }

    public Instant deadlineFor(Job job) {
        Instant started = job.getStartedAt() != null ? job.getStartedAt() : job.getUpdatedAt();
        return started.plus(timeoutFor(job.getPluginName())).plus(grace);
    }
}
