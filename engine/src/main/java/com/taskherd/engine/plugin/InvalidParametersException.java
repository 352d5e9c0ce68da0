package com.taskherd.engine.plugin;

import java.util.List;

/** Required parameters were missing when creating a job. */
public class InvalidParametersException extends RuntimeException {

    private final List<String> missing;

    public InvalidParametersException(String plugin, List<String> missing) {
        super("Plugin '" + plugin + "' is missing required parameters: " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() { return missing; }
}
