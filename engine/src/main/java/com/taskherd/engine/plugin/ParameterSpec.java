package com.taskherd.engine.plugin;

/**
 * One declared plugin parameter.
 *
 * @param type informational only ("string", "number", "boolean", "object", "list")
 */
public record ParameterSpec(
        String  name,
        String  type,
        boolean required,
        Object  defaultValue,
        String  description) {

    public static ParameterSpec required(String name, String type, String description) {
        return new ParameterSpec(name, type, true, null, description);
    }

    public static ParameterSpec optional(String name, String type, Object defaultValue, String description) {
        return new ParameterSpec(name, type, false, defaultValue, description);
    }
}
