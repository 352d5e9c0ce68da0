package com.taskherd.engine.webhook;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for the webhook endpoint: status codes only, ingestion mocked.
 */
@WebMvcTest(WebhookController.class)
class WebhookControllerTest {

    @Autowired   MockMvc                 mockMvc;
    @MockitoBean WebhookIngestionService ingestion;

    @Test
    void accepted_returns202WithJobIds() throws Exception {
        UUID id = UUID.randomUUID();
        when(ingestion.handle(any(), eq("sha256=ab"), eq("d-1"), eq("pull_request")))
                .thenReturn(WebhookOutcome.accepted(List.of(id)));

        mockMvc.perform(post("/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "pull_request")
                        .header("X-GitHub-Delivery", "d-1")
                        .header("X-Hub-Signature-256", "sha256=ab")
                        .content("{}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.jobIds[0]").value(id.toString()));
    }

    @Test
    void badSignature_returns401() throws Exception {
        when(ingestion.handle(any(), any(), any(), any()))
                .thenThrow(new SignatureVerificationException("signature mismatch"));

        mockMvc.perform(post("/webhooks/github").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("authentication failed"));
    }

    @Test
    void malformedPayload_returns400() throws Exception {
        when(ingestion.handle(any(), any(), any(), any()))
                .thenThrow(new MalformedPayloadException("webhook body is not a JSON object", null));

        mockMvc.perform(post("/webhooks/github").contentType(MediaType.APPLICATION_JSON).content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.accepted").value(false));
    }
}
