package com.taskherd.engine.plugin;

import com.taskherd.engine.config.TaskherdProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * In-process plugin registry.
 *
 * Every {@link TaskPlugin} bean, plus whatever the {@link PluginSource} beans
 * contribute, forms the catalog. The activation list decides which of them
 * are live and in which order:
 * <ul>
 *   <li>{@code taskherd.plugins.enabled}, then</li>
 *   <li>the {@code TASKHERD_PLUGINS} environment variable (appended),</li>
 * </ul>
 * each split on ':' or ','. An empty activation list activates the whole
 * catalog.
 *
 * <p>A plugin that is unknown, invalid or duplicated is logged and skipped;
 * one bad plugin never prevents the others from loading.
 */
@Component
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    static final String ENV_VAR = "TASKHERD_PLUGINS";

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_\\-]*");

    private final Map<String, TaskPlugin> plugins = new ConcurrentHashMap<>();
    private final List<String>            order   = new CopyOnWriteArrayList<>();
    private final MeterRegistry           meterRegistry;

    @Autowired
    public PluginRegistry(List<TaskPlugin> beans,
                          List<PluginSource> sources,
                          TaskherdProperties props,
                          MeterRegistry meterRegistry) {
        this(catalog(beans, sources),
             activationList(props.plugins().enabled(), System.getenv(ENV_VAR)),
             meterRegistry);
    }

    public PluginRegistry(List<TaskPlugin> catalog, List<String> activation, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        load(catalog, activation);
    }

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    private void load(List<TaskPlugin> catalog, List<String> activation) {
        Map<String, TaskPlugin> byName = new LinkedHashMap<>();
        for (TaskPlugin p : catalog) {
            String name = p.manifest() == null ? null : p.manifest().name();
            if (name == null) {
                log.warn("Skipping plugin {}: manifest has no name", p.getClass().getName());
                continue;
            }
            TaskPlugin previous = byName.putIfAbsent(name, p);
            if (previous != null) {
                log.warn("Skipping plugin {}: name '{}' already provided by {}",
                        p.getClass().getName(), name, previous.getClass().getName());
            }
        }

        List<String> wanted = activation.isEmpty() ? new ArrayList<>(byName.keySet()) : activation;
        for (String name : wanted) {
            try {
                TaskPlugin plugin = byName.get(name);
                if (plugin == null) {
                    throw new PluginLoadException("no plugin named '" + name + "' on the classpath or in configuration");
                }
                register(plugin);
            } catch (PluginLoadException | DuplicatePluginException e) {
                log.warn("Plugin '{}' not loaded: {}", name, e.getMessage());
            }
        }
        log.info("Active plugins: {}", order);
    }

    /**
     * Register a plugin under its manifest name.
     *
     * @throws DuplicatePluginException if the name is taken
     * @throws PluginLoadException      if the manifest is invalid
     */
    public void register(TaskPlugin plugin) {
        PluginManifest m = plugin.manifest();
        validate(m);
        if (plugins.putIfAbsent(m.name(), plugin) != null) {
            throw new DuplicatePluginException(m.name());
        }
        order.add(m.name());
        log.info("Registered plugin '{}' v{}{}", m.name(), m.version(),
                m.recurrence() != null ? " (recurring)" : "");
    }

    static void validate(PluginManifest m) {
        if (m == null || m.name() == null || !NAME.matcher(m.name()).matches()) {
            throw new PluginLoadException("invalid plugin name: " + (m == null ? null : m.name()));
        }
        Set<String> seen = new HashSet<>();
        for (ParameterSpec p : m.parameters()) {
            if (p.name() == null || p.name().isBlank() || !seen.add(p.name())) {
                throw new PluginLoadException("plugin '" + m.name() + "' declares a blank or duplicate parameter");
            }
        }
        RecurrenceDefault r = m.recurrence();
        if (r != null) {
            boolean hasCron = r.cron() != null && !r.cron().isBlank();
            boolean hasInterval = r.interval() != null;
            if (hasCron == hasInterval) {
                throw new PluginLoadException("plugin '" + m.name() + "' recurrence needs exactly one of cron or interval");
            }
            if (hasCron && !CronExpression.isValidExpression(r.cron())) {
                throw new PluginLoadException("plugin '" + m.name() + "' has invalid cron '" + r.cron() + "'");
            }
            if (hasInterval && (r.interval().isZero() || r.interval().isNegative())) {
                throw new PluginLoadException("plugin '" + m.name() + "' has non-positive interval");
            }
        }
        if (m.timeout() != null && (m.timeout().isZero() || m.timeout().isNegative())) {
            throw new PluginLoadException("plugin '" + m.name() + "' has non-positive timeout");
        }
        if (m.maxAttempts() != null && m.maxAttempts() < 1) {
            throw new PluginLoadException("plugin '" + m.name() + "' has maxAttempts < 1");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public TaskPlugin resolve(String name) {
        TaskPlugin plugin = name == null ? null : plugins.get(name);
        if (plugin == null) {
            throw new PluginNotFoundException(name);
        }
        return plugin;
    }

    public boolean contains(String name) {
        return name != null && plugins.containsKey(name);
    }

    /** Manifests of all active plugins, in activation order. */
    public List<PluginManifest> list() {
        return order.stream().map(n -> plugins.get(n).manifest()).toList();
    }

    public Duration timeoutFor(String name, Duration fallback) {
        Duration t = resolve(name).manifest().timeout();
        return t != null ? t : fallback;
    }

    public int maxAttemptsFor(String name, int fallback) {
        Integer n = resolve(name).manifest().maxAttempts();
        return n != null ? n : fallback;
    }

    /**
     * Check required parameters and merge declared defaults.
     *
     * @return a new map: caller params plus defaults for absent optional ones
     * @throws InvalidParametersException if a required parameter is missing
     */
    public Map<String, Object> applySchema(String name, Map<String, Object> params) {
        PluginManifest m = resolve(name).manifest();
        Map<String, Object> merged = new LinkedHashMap<>(params == null ? Map.of() : params);
        List<String> missing = new ArrayList<>();
        for (ParameterSpec spec : m.parameters()) {
            if (merged.get(spec.name()) != null) continue;
            if (spec.required()) {
                missing.add(spec.name());
            } else if (spec.defaultValue() != null) {
                merged.put(spec.name(), spec.defaultValue());
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidParametersException(name, missing);
        }
        return merged;
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named plugin, timing and counting every call:
     * <pre>
     *   taskherd.plugin.calls{plugin, status="success|execution_error|non_zero_exit|timeout|cancelled|..."}
     *   taskherd.plugin.duration{plugin}
     * </pre>
     *
     * Anything other than a {@link PluginException} escaping the plugin is
     * wrapped as {@link PluginException.Kind#EXECUTION_ERROR}.
     */
    public Map<String, Object> execute(String name, PluginContext ctx) {
        TaskPlugin plugin = resolve(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            Map<String, Object> result = plugin.execute(ctx);
            return result == null ? Map.of() : result;
        } catch (PluginException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "execution_error";
            throw new PluginException(PluginException.Kind.EXECUTION_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), null, e);
        } finally {
            sample.stop(meterRegistry.timer("taskherd.plugin.duration", "plugin", name));
            meterRegistry.counter("taskherd.plugin.calls", "plugin", name, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static List<TaskPlugin> catalog(List<TaskPlugin> beans, List<PluginSource> sources) {
        List<TaskPlugin> all = new ArrayList<>(beans);
        for (PluginSource source : sources) {
            all.addAll(source.plugins());
        }
        return all;
    }

    /**
     * Merge the configured activation string with the environment one,
     * keeping first-seen order and dropping repeats with a warning.
     */
    static List<String> activationList(String configured, String fromEnv) {
        Set<String> names = new LinkedHashSet<>();
        for (String raw : new String[] {configured, fromEnv}) {
            if (raw == null || raw.isBlank()) continue;
            Arrays.stream(raw.split("[:,]"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(s -> {
                        if (!names.add(s)) {
                            log.warn("Plugin {} listed more than once; skipping repeat", s);
                        }
                    });
        }
        return List.copyOf(names);
    }
}
