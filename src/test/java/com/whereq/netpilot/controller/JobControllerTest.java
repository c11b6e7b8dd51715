package com.whereq.netpilot.controller;

import com.whereq.netpilot.broadcast.BroadcastChannel;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TargetSpec;
import com.whereq.netpilot.support.NetPilotEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP surface tests bound directly to the controllers.
 */
@DisplayName("REST Controller Tests")
class JobControllerTest {

    private NetPilotEngine engine;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = new NetPilotEngine().start();
        client = WebTestClient.bindToController(
                new JobController(engine.lifecycleManager, engine.broadcast),
                new CommandController(engine.classifier),
                new HealthController(engine.jobQueue, engine.lifecycleManager, engine.classifier))
            .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should accept a command run with 202 and expose the job")
    void testSubmitAndGet() {
        Map<?, ?> accepted = client.post().uri("/api/v1/jobs/commands")
            .header(JobController.TENANT_HEADER, "acme")
            .header(JobController.USER_HEADER, "alice")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("targets", Map.of("deviceIds", List.of(1, 2)), "commands", List.of("show version")))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.ACCEPTED)
            .expectHeader().exists("Location")
            .expectBody(Map.class)
            .returnResult()
            .getResponseBody();

        String jobId = (String) accepted.get("jobId");
        assertNotNull(jobId);
        assertEquals("queued", accepted.get("status"));
        engine.awaitTerminal(jobId);

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .header(JobController.TENANT_HEADER, "acme")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("success")
            .jsonPath("$.type").isEqualTo("run_commands")
            .jsonPath("$.requestedBy").isEqualTo("alice")
            .jsonPath("$.results.length()").isEqualTo(2)
            .jsonPath("$.results[0].status").isEqualTo("success");

        client.get().uri("/api/v1/jobs/{id}/logs", jobId)
            .header(JobController.TENANT_HEADER, "acme")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].message").value(message -> assertTrue(((String) message).startsWith("Submitted run_commands")));

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .header(JobController.TENANT_HEADER, "globex")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Should answer 409 with the flagged commands when confirmation is missing")
    void testConfirmationRequired() {
        client.post().uri("/api/v1/jobs/commands")
            .header(JobController.TENANT_HEADER, "acme")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("targets", Map.of("site", "hq"), "commands", List.of("show version", "write erase")))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.CONFLICT)
            .expectBody()
            .jsonPath("$.flaggedCommands[0]").isEqualTo("write erase")
            .jsonPath("$.jobId").doesNotExist();

        assertTrue(engine.transport.getCalls().isEmpty());
    }

    @Test
    @DisplayName("Should answer 400 with the offending ids for devices outside the tenant")
    void testInvalidTargets() {
        client.post().uri("/api/v1/jobs/backups")
            .header(JobController.TENANT_HEADER, "acme")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("targets", Map.of("deviceIds", List.of(1, 9))))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.invalidDeviceIds[0]").isEqualTo(9);
    }

    @Test
    @DisplayName("Should answer 400 when the tenant header is missing")
    void testMissingTenant() {
        client.post().uri("/api/v1/jobs/commands")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("targets", Map.of("site", "hq"), "commands", List.of("show version")))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("Should answer 409 for a commit of an unknown preview")
    void testStaleCommit() {
        client.post().uri("/api/v1/jobs/deploy/commit")
            .header(JobController.TENANT_HEADER, "acme")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("previousJobId", "job-unknown", "confirm", true))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.CONFLICT)
            .expectBody()
            .jsonPath("$.errorMessage").value(message -> assertTrue(((String) message).contains("not found")));
    }

    @Test
    @DisplayName("Should answer 409 when cancelling a finished job")
    void testCancelFinishedJob() {
        String jobId = engine.lifecycleManager.submit(showVersion(), NetPilotEngine.OPERATOR).block();
        engine.awaitTerminal(jobId);

        client.delete().uri("/api/v1/jobs/{id}", jobId)
            .header(JobController.TENANT_HEADER, "acme")
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("Should stream a single status event for a finished job")
    void testEventsOfFinishedJob() {
        String jobId = engine.lifecycleManager.submit(showVersion(), NetPilotEngine.OPERATOR).block();
        engine.awaitTerminal(jobId);

        Flux<JobEvent> events = client.get().uri("/api/v1/jobs/{id}/events", jobId)
            .header(JobController.TENANT_HEADER, "acme")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobEvent.class)
            .getResponseBody();

        StepVerifier.create(events)
            .assertNext(event -> {
                assertEquals(JobEvent.Type.STATUS, event.getType());
                assertEquals(JobStatus.SUCCESS, event.getStatus());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should end the stream with the terminal status even when the broadcast misses it")
    void testEventsEndWhenBroadcastMissesTerminal() {
        engine.transport.latency(Duration.ofMillis(300));
        BroadcastChannel silent = new BroadcastChannel() {
            @Override
            public Mono<Void> publish(String jobId, JobEvent event) {
                return Mono.empty();
            }

            @Override
            public Flux<JobEvent> subscribe(String jobId) {
                return Flux.never();
            }
        };
        WebTestClient silentClient = WebTestClient.bindToController(
                new JobController(engine.lifecycleManager, silent))
            .build();
        String jobId = engine.lifecycleManager.submit(showVersion(), NetPilotEngine.OPERATOR).block();

        Flux<JobEvent> events = silentClient.get().uri("/api/v1/jobs/{id}/events", jobId)
            .header(JobController.TENANT_HEADER, "acme")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobEvent.class)
            .getResponseBody();

        StepVerifier.create(events)
            .assertNext(event -> {
                assertEquals(JobEvent.Type.STATUS, event.getType());
                assertEquals(JobStatus.SUCCESS, event.getStatus());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should classify commands without creating a job")
    void testClassify() {
        client.post().uri("/api/v1/commands/classify")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("commands", List.of("show version", "reload")))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.confirmationRequired").isEqualTo(true)
            .jsonPath("$.ruleSetVersion").isEqualTo("builtin-2")
            .jsonPath("$.flagged.length()").isEqualTo(1)
            .jsonPath("$.flagged[0].category").isEqualTo("RELOAD");

        assertEquals(0, engine.lifecycleManager.getActiveJobCount());
    }

    @Test
    @DisplayName("Should list suggestions for a platform")
    void testSuggestions() {
        client.get().uri("/api/v1/commands/suggestions?platform=EOS")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[8]").isEqualTo("show environment all");
    }

    @Test
    @DisplayName("Should report health with queue information")
    void testHealth() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.service").isEqualTo("whereq-netpilot")
            .jsonPath("$.queue.status").isEqualTo("CONNECTED");
    }

    private static JobSubmission showVersion() {
        return JobSubmission.builder()
            .type(JobType.RUN_COMMANDS)
            .targets(TargetSpec.builder().site("hq").build())
            .payload(JobPayload.builder().commands(List.of("show version")).build())
            .build();
    }
}
