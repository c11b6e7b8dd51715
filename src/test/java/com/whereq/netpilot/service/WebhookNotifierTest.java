package com.whereq.netpilot.service;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.Notifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for WebhookNotifier.
 */
@DisplayName("WebhookNotifier Tests")
class WebhookNotifierTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private HttpStatus responseStatus;
    private WebhookNotifier notifier;

    @BeforeEach
    void setUp() {
        responseStatus = HttpStatus.OK;
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(responseStatus).build());
        });
        notifier = new WebhookNotifier(builder, new NetPilotProperties());
    }

    @Test
    @DisplayName("Should post to the webhook when the job reaches a subscribed status")
    void testNotifiesSubscribedStatus() {
        StepVerifier.create(notifier.notifyIfRequested(job(JobStatus.PARTIAL_FAILURE)))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("https://hooks.example.com/netpilot", requests.get(0).url().toString());
    }

    @Test
    @DisplayName("Should not post for statuses the job did not subscribe to")
    void testSkipsUnsubscribedStatus() {
        StepVerifier.create(notifier.notifyIfRequested(job(JobStatus.RUNNING)))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("Should swallow webhook errors")
    void testWebhookErrorDoesNotPropagate() {
        responseStatus = HttpStatus.INTERNAL_SERVER_ERROR;

        StepVerifier.create(notifier.notifyIfRequested(job(JobStatus.FAILED)))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("Should describe the job in the payload")
    void testPayload() {
        Map<String, Object> payload = WebhookNotifier.buildPayload(job(JobStatus.SUCCESS));

        assertEquals("job-1", payload.get("jobId"));
        assertEquals(JobType.RUN_COMMANDS, payload.get("type"));
        assertEquals(JobStatus.SUCCESS, payload.get("status"));
        assertEquals("acme", payload.get("tenantId"));
        assertEquals("alice", payload.get("requestedBy"));
    }

    private static Job job(JobStatus status) {
        return Job.builder()
            .id("job-1")
            .type(JobType.RUN_COMMANDS)
            .status(status)
            .tenantId("acme")
            .requestedBy("alice")
            .summary(JobSummary.empty())
            .finishedAt(status.isTerminal() ? Instant.now() : null)
            .notifications(Notifications.builder()
                .webhook("https://hooks.example.com/netpilot")
                .build())
            .build();
    }
}
