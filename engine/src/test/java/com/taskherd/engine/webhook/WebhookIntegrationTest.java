package com.taskherd.engine.webhook;

import com.jayway.jsonpath.JsonPath;
import com.taskherd.engine.IntegrationTestSupport;
import com.taskherd.engine.model.Job;
import com.taskherd.engine.model.JobOrigin;
import com.taskherd.engine.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Signed deliveries through the HTTP endpoint into the store, using the
 * rule from the test configuration (pull_request opened/synchronize → echo).
 */
class WebhookIntegrationTest extends IntegrationTestSupport {

    private static final String PR_OPENED = """
            {"action":"opened","number":9,
             "pull_request":{"head":{"sha":"feedface00","ref":"topic"}},
             "repository":{"full_name":"org/app"}}
            """;

    @Autowired MockMvc           mockMvc;
    @Autowired SignatureVerifier verifier;
    @Autowired JobService        jobService;

    @Test
    void delivery_createsWebhookJobWithTarget() throws Exception {
        String response = deliver("d1", PR_OPENED)
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.jobIds.length()").value(1))
                .andReturn().getResponse().getContentAsString();

        String jobId = JsonPath.read(response, "$.jobIds[0]");
        Job job = jobService.findById(UUID.fromString(jobId)).orElseThrow();
        assertThat(job.getOrigin()).isEqualTo(JobOrigin.WEBHOOK);
        assertThat(job.getPluginName()).isEqualTo("echo");
        assertThat(job.getReportTarget()).isEqualTo("org/app#9");
        assertThat(jobService.params(job)).containsEntry("x", "from-webhook").containsEntry("head_sha", "feedface00");
    }

    @Test
    void redelivery_doesNotDuplicateJobs() throws Exception {
        deliver("d1", PR_OPENED).andExpect(status().isAccepted());
        deliver("d1", PR_OPENED).andExpect(status().isAccepted());

        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(1);
        assertThat(count("SELECT COUNT(*) FROM jobs WHERE correlation_key = 'webhook:d1:echo'")).isEqualTo(1);

        deliver("d2", PR_OPENED).andExpect(status().isAccepted());
        assertThat(count("SELECT COUNT(*) FROM jobs")).isEqualTo(2);
    }

    @Test
    void tamperedBody_isRejectedAndCreatesNothing() throws Exception {
        String signature = verifier.signatureFor(PR_OPENED.getBytes(StandardCharsets.UTF_8));
        String tampered = PR_OPENED.replace("\"number\":9", "\"number\":10");

        mockMvc.perform(post("/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "pull_request")
                        .header("X-GitHub-Delivery", "d3")
                        .header("X-Hub-Signature-256", signature)
                        .content(tampered))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.accepted").value(false));

        assertThat(count("SELECT COUNT(*) FROM jobs")).isZero();
    }

    @Test
    void closedPullRequest_isAcceptedWithoutJobs() throws Exception {
        deliver("d4", PR_OPENED.replace("opened", "closed"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobIds").isEmpty());

        assertThat(count("SELECT COUNT(*) FROM jobs")).isZero();
    }

    private ResultActions deliver(String deliveryId, String body) throws Exception {
        byte[] raw = body.getBytes(StandardCharsets.UTF_8);
        return mockMvc.perform(post("/webhooks/github")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-GitHub-Event", "pull_request")
                .header("X-GitHub-Delivery", deliveryId)
                .header("X-Hub-Signature-256", verifier.signatureFor(raw))
                .content(raw));
    }
}
