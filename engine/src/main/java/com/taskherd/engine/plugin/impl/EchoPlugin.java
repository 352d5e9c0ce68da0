package com.taskherd.engine.plugin.impl;

import com.taskherd.engine.plugin.ParameterSpec;
import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.TaskPlugin;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/** Returns its {@code x} parameter unchanged. Handy for smoke-testing a deployment. */
@Component
public class EchoPlugin implements TaskPlugin {

    private static final PluginManifest MANIFEST = PluginManifest.of(
            "echo",
            "Return the value of parameter x as return_value.",
            ParameterSpec.optional("x", "string", null, "Value to echo back"));

    @Override
    public PluginManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Map<String, Object> execute(PluginContext ctx) {
        Map<String, Object> result = new HashMap<>();
        result.put("return_value", ctx.param("x"));
        return result;
    }
}
