package com.taskherd.engine.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskherd.engine.report.TargetRef;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job parameters and report target pulled out of a webhook payload.
 *
 * @param target null when the event has nothing to comment on
 */
record EventContext(Map<String, Object> params, String target) {

    private static final String ZERO_SHA = "0000000000000000000000000000000000000000";

    static EventContext from(String eventType, JsonNode payload) {
        Map<String, Object> params = new LinkedHashMap<>();
        String repo = text(payload.path("repository").path("full_name"));
        put(params, "repository", repo);
        put(params, "action", text(payload.path("action")));
        put(params, "sender", text(payload.path("sender").path("login")));

        String target = null;
        if ("pull_request".equals(eventType)) {
            JsonNode pr = payload.path("pull_request");
            long number = payload.path("number").asLong(pr.path("number").asLong(0));
            if (number > 0) {
                params.put("pull_number", number);
            }
            put(params, "head_sha", text(pr.path("head").path("sha")));
            put(params, "head_ref", text(pr.path("head").path("ref")));
            put(params, "title", text(pr.path("title")));
            String cloneUrl = text(pr.path("head").path("repo").path("clone_url"));
            put(params, "clone_url", cloneUrl != null ? cloneUrl : text(payload.path("repository").path("clone_url")));
            if (repo != null && number > 0) {
                target = TargetRef.issue(repo, number).toString();
            }
        } else if ("push".equals(eventType)) {
            String after = text(payload.path("after"));
            put(params, "head_sha", after);
            put(params, "ref", text(payload.path("ref")));
            put(params, "clone_url", text(payload.path("repository").path("clone_url")));
            // An all-zero "after" is a branch deletion: nothing to comment on.
            if (repo != null && after != null && !ZERO_SHA.equals(after)) {
                target = TargetRef.commit(repo, after).toString();
            }
        }
        return new EventContext(params, target);
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static void put(Map<String, Object> params, String key, String value) {
        if (value != null) {
            params.put(key, value);
        }
    }
}
