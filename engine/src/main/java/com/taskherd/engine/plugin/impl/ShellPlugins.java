package com.taskherd.engine.plugin.impl;

import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.PluginSource;
import com.taskherd.engine.plugin.TaskPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one {@link ShellCommandPlugin} per {@code taskherd.plugins.shell[]}
 * entry, e.g.
 * <pre>
 * taskherd:
 *   plugins:
 *     shell:
 *       - name: maven_test
 *         command: [mvn, -B, test]
 *         working-directory: /srv/checkout
 *         timeout: 20m
 * </pre>
 * Malformed entries are logged and left out.
 */
@Component
public class ShellPlugins implements PluginSource {

    private static final Logger log = LoggerFactory.getLogger(ShellPlugins.class);

    private final List<TaskPlugin> plugins = new ArrayList<>();

    public ShellPlugins(TaskherdProperties props) {
        for (TaskherdProperties.ShellPlugin cfg : props.plugins().shell()) {
            try {
                PluginManifest manifest = new PluginManifest(
                        cfg.name(), "shell",
                        cfg.description() != null ? cfg.description() : "Runs " + cfg.command(),
                        List.of(), null, cfg.timeout(), null);
                File dir = cfg.workingDirectory() != null ? new File(cfg.workingDirectory()) : null;
                plugins.add(new ShellCommandPlugin(manifest, cfg.command(), dir));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping shell plugin '{}': {}", cfg.name(), e.getMessage());
            }
        }
    }

    @Override
    public List<TaskPlugin> plugins() {
        return List.copyOf(plugins);
    }
}
