package com.taskherd.engine.plugin;

/**
 * A plugin could not be activated. Never fatal: the registry logs it and
 * carries on with the remaining plugins.
 */
public class PluginLoadException extends RuntimeException {
    public PluginLoadException(String message) {
        super(message);
    }
}
