package com.taskherd.engine.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskherd.engine.config.TaskherdProperties;
import com.taskherd.engine.model.JobOrigin;
import com.taskherd.engine.plugin.InvalidParametersException;
import com.taskherd.engine.plugin.PluginNotFoundException;
import com.taskherd.engine.service.JobRequest;
import com.taskherd.engine.service.JobService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns signed host events into jobs.
 *
 * <ol>
 *   <li>Verify the HMAC over the raw body. Any mismatch rejects the delivery
 *       before the body is even parsed.</li>
 *   <li>Parse, then match the event type and action against
 *       {@code taskherd.webhook.rules}.</li>
 *   <li>Create one job per mapped plugin, keyed
 *       {@code webhook:<deliveryId>:<plugin>} so the host's automatic
 *       redeliveries land on the jobs that already exist.</li>
 * </ol>
 * Events no rule maps (including {@code ping}) are accepted with no jobs.
 */
@Service
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    private final SignatureVerifier             verifier;
    private final JobService                    jobService;
    private final ObjectMapper                  json;
    private final List<TaskherdProperties.Rule> rules;
    private final MeterRegistry                 meterRegistry;

    public WebhookIngestionService(SignatureVerifier verifier,
                                   JobService jobService,
                                   ObjectMapper objectMapper,
                                   TaskherdProperties props,
                                   MeterRegistry meterRegistry) {
        this.verifier      = verifier;
        this.jobService    = jobService;
        this.json          = objectMapper;
        this.rules         = props.webhook().rules();
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param deliveryId host delivery id; when absent the SHA-256 of the body stands in
     * @throws SignatureVerificationException the signature does not match; nothing was created
     * @throws MalformedPayloadException      signed, but not a JSON object; nothing was created
     */
    public WebhookOutcome handle(byte[] rawBody, String signatureHeader, String deliveryId, String eventType) {
        try {
            verifier.verify(rawBody, signatureHeader);
        } catch (SignatureVerificationException e) {
            log.warn("Rejected webhook delivery {} ({}): {}", deliveryId, eventType, e.getMessage());
            count(eventType, "rejected");
            throw e;
        }

        JsonNode payload;
        try {
            payload = json.readTree(rawBody);
        } catch (IOException e) {
            count(eventType, "malformed");
            throw new MalformedPayloadException("webhook body is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            count(eventType, "malformed");
            throw new MalformedPayloadException("webhook body is not a JSON object", null);
        }

        String delivery = deliveryId != null && !deliveryId.isBlank() ? deliveryId : sha256Hex(rawBody);
        String action   = payload.path("action").isTextual() ? payload.path("action").asText() : null;

        List<String> plugins = pluginsFor(eventType, action);
        if (plugins.isEmpty()) {
            log.info("Webhook {} ({}{}) matches no rule; accepted without jobs",
                    delivery, eventType, action != null ? "/" + action : "");
            count(eventType, "ignored");
            return WebhookOutcome.accepted(List.of());
        }

        EventContext ctx = EventContext.from(eventType, payload);
        List<UUID> jobIds = new ArrayList<>();
        for (String plugin : plugins) {
            Map<String, Object> params = new LinkedHashMap<>(ctx.params());
            params.putAll(staticParams(eventType, action, plugin));
            try {
                jobIds.add(jobService.createJob(new JobRequest(plugin, params, null,
                        correlationKey(delivery, plugin), JobOrigin.WEBHOOK, ctx.target())));
            } catch (PluginNotFoundException | InvalidParametersException e) {
                // A misconfigured rule must not make the host think the endpoint is broken.
                log.error("Webhook {} rule for plugin '{}' could not create a job: {}", delivery, plugin, e.getMessage());
            }
        }
        log.info("Webhook {} ({}{}) → jobs {}", delivery, eventType, action != null ? "/" + action : "", jobIds);
        count(eventType, "accepted");
        return WebhookOutcome.accepted(jobIds);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Plugins of every matching rule, first occurrence wins. */
    List<String> pluginsFor(String eventType, String action) {
        List<String> out = new ArrayList<>();
        if (eventType == null) return out;
        for (TaskherdProperties.Rule rule : rules) {
            if (rule.matches(eventType, action) && rule.plugins() != null) {
                for (String p : rule.plugins()) {
                    if (!out.contains(p)) out.add(p);
                }
            }
        }
        return out;
    }

    private Map<String, Object> staticParams(String eventType, String action, String plugin) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (TaskherdProperties.Rule rule : rules) {
            if (rule.matches(eventType, action) && rule.plugins() != null
                    && rule.plugins().contains(plugin) && rule.params() != null) {
                merged.putAll(rule.params());
            }
        }
        return merged;
    }

    static String correlationKey(String deliveryId, String plugin) {
        return "webhook:" + deliveryId + ":" + plugin;
    }

    static String sha256Hex(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private void count(String eventType, String outcome) {
        meterRegistry.counter("taskherd.webhook.deliveries",
                "event", eventType == null ? "none" : eventType, "outcome", outcome).increment();
    }
}
