package com.whereq.netpilot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for webhook subscriptions and queue entries.
 */
@DisplayName("Notifications and QueuedJob Tests")
class NotificationsTest {

    @Test
    @DisplayName("Should deliver every terminal status when none are listed")
    void testDefaultsToTerminalStatuses() {
        Notifications notifications = Notifications.builder().webhook("https://hooks.example.com/netpilot").build();

        assertTrue(notifications.shouldNotify(JobStatus.SUCCESS));
        assertTrue(notifications.shouldNotify(JobStatus.NO_TARGETS));
        assertFalse(notifications.shouldNotify(JobStatus.QUEUED));
        assertFalse(notifications.shouldNotify(JobStatus.RUNNING));
    }

    @Test
    @DisplayName("Should deliver only the listed statuses")
    void testListedStatuses() {
        Notifications notifications = Notifications.builder()
            .webhook("https://hooks.example.com/netpilot")
            .status(JobStatus.RUNNING)
            .status(JobStatus.FAILED)
            .build();

        assertTrue(notifications.shouldNotify(JobStatus.RUNNING));
        assertTrue(notifications.shouldNotify(JobStatus.FAILED));
        assertFalse(notifications.shouldNotify(JobStatus.SUCCESS));
    }

    @Test
    @DisplayName("Should stay silent without a webhook")
    void testNoWebhook() {
        Notifications notifications = Notifications.builder().status(JobStatus.SUCCESS).build();

        assertFalse(notifications.hasWebhook());
        assertFalse(notifications.shouldNotify(JobStatus.SUCCESS));
    }

    @Test
    @DisplayName("Should wait only for future execution times")
    void testQueuedJobDelay() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        QueuedJob immediate = QueuedJob.builder().jobId("job-1").build();
        QueuedJob overdue = QueuedJob.builder().jobId("job-2").executeAt(now.minusSeconds(30)).build();
        QueuedJob later = QueuedJob.builder().jobId("job-3").executeAt(now.plusSeconds(90)).build();

        assertEquals(Duration.ZERO, immediate.delayFrom(now));
        assertEquals(Duration.ZERO, overdue.delayFrom(now));
        assertEquals(Duration.ofSeconds(90), later.delayFrom(now));
    }

    @Test
    @DisplayName("Should carry the job reference and schedule into the queue entry")
    void testQueuedJobFromJob() {
        Instant executeAt = Instant.parse("2026-03-01T12:00:00Z");
        Job job = Job.builder()
            .id("job-7")
            .type(JobType.BACKUP)
            .tenantId("acme")
            .scheduledFor(executeAt)
            .build();

        QueuedJob queued = QueuedJob.of(job, executeAt.minusSeconds(60));

        assertEquals("job-7", queued.getJobId());
        assertEquals("acme", queued.getTenantId());
        assertEquals(JobType.BACKUP, queued.getType());
        assertEquals(executeAt, queued.getExecuteAt());
    }
}
