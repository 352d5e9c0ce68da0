package com.taskherd.engine.webhook;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound endpoint for the version-control host.
 *
 * POST /webhooks/github
 *   202 {"accepted":true,"jobIds":[...]}                   verified (jobs may be empty)
 *   401 {"accepted":false,"error":"authentication failed"} bad or missing signature
 *   400 {"accepted":false,"error":"malformed payload"}     verified, but not JSON
 *
 * The body is taken as raw bytes: the signature covers the exact bytes sent.
 * Job results are never returned here; they are reported asynchronously.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestion;

    public WebhookController(WebhookIngestionService ingestion) {
        this.ingestion = ingestion;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> github(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestHeader(value = "X-GitHub-Delivery",   required = false) String deliveryId,
            @RequestHeader(value = "X-GitHub-Event",      required = false) String eventType) {
        byte[] raw = body != null ? body : new byte[0];
        try {
            WebhookOutcome outcome = ingestion.handle(raw, signature, deliveryId, eventType);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("accepted", true, "jobIds", outcome.jobIds()));
        } catch (SignatureVerificationException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("accepted", false, "error", "authentication failed"));
        } catch (MalformedPayloadException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("accepted", false, "error", "malformed payload"));
        }
    }
}
