package com.taskherd.engine.plugin;

public class PluginNotFoundException extends RuntimeException {
    public PluginNotFoundException(String name) {
        super("No plugin registered with name: '" + name + "'");
    }
}
