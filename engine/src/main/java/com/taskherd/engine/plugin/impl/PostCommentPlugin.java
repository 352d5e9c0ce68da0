package com.taskherd.engine.plugin.impl;

import com.taskherd.engine.plugin.ParameterSpec;
import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginException;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.TaskPlugin;
import com.taskherd.engine.report.DeliveryException;
import com.taskherd.engine.report.HostClient;
import com.taskherd.engine.report.TargetRef;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Posts a fixed message to a pull request or commit. Useful as a webhook
 * rule action ("thanks for the PR") or to test host credentials.
 */
@Component
public class PostCommentPlugin implements TaskPlugin {

    private static final PluginManifest MANIFEST = PluginManifest.of(
            "post_comment",
            "Post a comment on a pull request (owner/repo#n) or commit (owner/repo@sha).",
            ParameterSpec.required("target",  "string", "owner/repo#n or owner/repo@sha"),
            ParameterSpec.required("message", "string", "Markdown comment body"));

    private final HostClient host;

    public PostCommentPlugin(HostClient host) {
        this.host = host;
    }

    @Override
    public PluginManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Map<String, Object> execute(PluginContext ctx) {
        TargetRef target;
        try {
            target = TargetRef.parse(ctx.stringParam("target"));
        } catch (IllegalArgumentException e) {
            throw new PluginException(PluginException.Kind.INVALID_PARAMS, e.getMessage());
        }
        try {
            host.postComment(target, ctx.stringParam("message"));
        } catch (DeliveryException e) {
            throw new PluginException(PluginException.Kind.EXECUTION_ERROR, e.getMessage(), null, e);
        }
        return Map.of("return_value", "posted to " + target);
    }
}
