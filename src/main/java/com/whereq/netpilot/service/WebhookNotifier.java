package com.whereq.netpilot.service;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.Notifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts job state changes to the webhook a submission subscribed with.
 * Delivery is best effort: failures are logged and never reach the job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotifier {

    private final WebClient.Builder webClientBuilder;
    private final NetPilotProperties properties;

    /**
     * Notify the job's webhook if it subscribed to the job's current status
     *
     * @param job job after a state change
     * @return Mono that completes when the notification was sent or dropped
     */
    public Mono<Void> notifyIfRequested(Job job) {
        Notifications notifications = job.getNotifications();
        if (notifications == null || !notifications.shouldNotify(job.getStatus())) {
            return Mono.empty();
        }
        return notify(notifications.getWebhook(), job);
    }

    /**
     * Post the job state to a webhook
     *
     * @param webhookUrl webhook URL
     * @param job job after a state change
     * @return Mono that completes when notification sent
     */
    public Mono<Void> notify(String webhookUrl, Job job) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(job))
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.getWebhook().getTimeout())
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getId(), job.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.warn("Failed to send webhook notification for job {}: {}",
                job.getId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .then();
    }

    static Map<String, Object> buildPayload(Job job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("type", job.getType());
        payload.put("status", job.getStatus());
        payload.put("tenantId", job.getTenantId());
        payload.put("requestedBy", job.getRequestedBy());
        payload.put("summary", job.getSummary());
        payload.put("finishedAt", job.getFinishedAt());
        return payload;
    }
}
