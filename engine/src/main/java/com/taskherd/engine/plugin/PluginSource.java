package com.taskherd.engine.plugin;

import java.util.List;

/**
 * Contributes plugins that are not beans themselves, e.g. plugins built
 * from configuration entries.
 */
public interface PluginSource {

    List<TaskPlugin> plugins();
}
