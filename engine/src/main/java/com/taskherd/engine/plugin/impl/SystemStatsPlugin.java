package com.taskherd.engine.plugin.impl;

import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.TaskPlugin;
import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Samples load, memory and disk usage of the host the worker runs on.
 * Typically attached to an interval schedule as a cheap liveness record.
 */
@Component
public class SystemStatsPlugin implements TaskPlugin {

    private static final PluginManifest MANIFEST = PluginManifest.of(
            "system_stats", "Report host load average, JVM memory and disk usage.");

    @Override
    public PluginManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Map<String, Object> execute(PluginContext ctx) {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Runtime rt = Runtime.getRuntime();

        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("max_bytes",   rt.maxMemory());
        memory.put("total_bytes", rt.totalMemory());
        memory.put("free_bytes",  rt.freeMemory());

        List<Map<String, Object>> disks = new ArrayList<>();
        for (File root : File.listRoots()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("path",         root.getAbsolutePath());
            d.put("total_bytes",  root.getTotalSpace());
            d.put("usable_bytes", root.getUsableSpace());
            disks.add(d);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("processors",   os.getAvailableProcessors());
        result.put("load_average", os.getSystemLoadAverage());   // -1 when unsupported
        result.put("memory",       memory);
        result.put("disks",        disks);
        result.put("return_value", "load=%.2f cpus=%d".formatted(
                os.getSystemLoadAverage(), os.getAvailableProcessors()));
        return result;
    }
}
