package com.taskherd.engine.api;

import com.taskherd.engine.api.dto.PluginResponse;
import com.taskherd.engine.plugin.PluginRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /plugins          active plugins, in activation order
 * GET /plugins/{name}   one plugin's manifest (404 if not active)
 */
@RestController
@RequestMapping("/plugins")
public class PluginController {

    private final PluginRegistry registry;

    public PluginController(PluginRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<PluginResponse> list() {
        return registry.list().stream().map(PluginResponse::from).toList();
    }

    @GetMapping("/{name}")
    public PluginResponse get(@PathVariable String name) {
        return PluginResponse.from(registry.resolve(name).manifest());
    }
}
