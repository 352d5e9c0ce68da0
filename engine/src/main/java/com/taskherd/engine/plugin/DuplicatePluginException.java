package com.taskherd.engine.plugin;

public class DuplicatePluginException extends RuntimeException {
    public DuplicatePluginException(String name) {
        super("A plugin named '" + name + "' is already registered");
    }
}
