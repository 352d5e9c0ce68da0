package com.taskherd.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskherd.engine.config.TaskherdProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HostClient} for the GitHub REST API.
 *
 * <pre>
 *   owner/repo#n    POST /repos/{owner}/{repo}/issues/{n}/comments
 *   owner/repo@sha  POST /repos/{owner}/{repo}/commits/{sha}/comments
 * </pre>
 * Authenticated with {@code taskherd.github.token} as a Bearer token.
 */
@Component
public class GitHubClient implements HostClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final String API_VERSION = "2022-11-28";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       token;
    private final Duration     timeout;

    public GitHubClient(TaskherdProperties props, ObjectMapper objectMapper) {
        TaskherdProperties.GitHub cfg = props.github();
        this.apiUrl  = cfg.apiUrl().endsWith("/") ? cfg.apiUrl().substring(0, cfg.apiUrl().length() - 1) : cfg.apiUrl();
        this.token   = cfg.token();
        this.timeout = cfg.timeout();
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void postComment(TargetRef target, String message) {
        if (token == null || token.isBlank()) {
            throw new DeliveryException("No GitHub token configured (taskherd.github.token)", false);
        }
        String path = switch (target.kind()) {
            case ISSUE  -> "/repos/" + target.owner() + "/" + target.repo() + "/issues/" + target.ref() + "/comments";
            case COMMIT -> "/repos/" + target.owner() + "/" + target.repo() + "/commits/" + target.ref() + "/comments";
        };
        post(path, toJson(Map.of("body", message)), "comment on " + target);
        log.info("Posted comment on {}", target);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void post(String path, String jsonBody, String opName) {
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl + path))
                    .timeout(timeout)
                    .header("Content-Type",         "application/json")
                    .header("Accept",               "application/vnd.github+json")
                    .header("Authorization",        "Bearer " + token)
                    .header("X-GitHub-Api-Version", API_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException(opName + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(opName + " interrupted", true, e);
        }

        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        throw new DeliveryException(opName + " failed: HTTP " + status + ": " + abbreviate(resp.body()),
                isRetryable(status, resp.headers().firstValue("X-RateLimit-Remaining").orElse(null)));
    }

    /** 429, 5xx, and 403 with an exhausted rate limit are worth another try. */
    static boolean isRetryable(int status, String rateLimitRemaining) {
        if (status == 429 || status >= 500) {
            return true;
        }
        return status == 403 && "0".equals(rateLimitRemaining);
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("JSON serialization failed", false, e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
