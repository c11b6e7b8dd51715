package com.whereq.netpilot.service;

import com.whereq.netpilot.exception.IllegalJobTransitionException;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceResultStatus;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobProgress;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.RetryPolicy;
import com.whereq.netpilot.store.InMemoryJobStore;
import com.whereq.netpilot.support.RecordingBroadcastChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for JobRun.
 */
@DisplayName("JobRun Tests")
class JobRunTest {

    private InMemoryJobStore store;
    private RecordingBroadcastChannel broadcast;
    private JobRun run;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        broadcast = new RecordingBroadcastChannel();
        Job job = Job.builder()
            .id("job-1")
            .type(JobType.RUN_COMMANDS)
            .status(JobStatus.QUEUED)
            .tenantId("acme")
            .createdAt(Instant.now())
            .build();
        store.create(job).block();
        run = new JobRun(job, store, broadcast, RetryPolicy.defaultPolicy().toRetrySpec());
    }

    @Test
    @DisplayName("Should never leave a terminal state")
    void testTerminalIsFinal() {
        run.transition(JobStatus.RUNNING);
        run.finish(JobStatus.SUCCESS, JobSummary.empty()).block(Duration.ofSeconds(5));

        assertThrows(IllegalJobTransitionException.class, () -> run.finish(JobStatus.FAILED, JobSummary.empty()));
        assertThrows(IllegalStateException.class, () -> run.append(JobLogEntry.info(null, "late")));
        assertThrows(IllegalStateException.class, () -> run.onResult(result(1), progress()));
        assertEquals(JobStatus.SUCCESS, run.status());
        assertEquals(JobStatus.SUCCESS, store.get("job-1").block().getStatus());
    }

    @Test
    @DisplayName("Should reject transitions the state machine does not allow")
    void testIllegalTransition() {
        assertThrows(IllegalJobTransitionException.class, () -> run.finish(JobStatus.SUCCESS, JobSummary.empty()));
        assertThrows(IllegalArgumentException.class, () -> run.transition(JobStatus.CANCELLED));
        assertEquals(JobStatus.QUEUED, run.status());
    }

    @Test
    @DisplayName("Should write logs and results in the order they were recorded")
    void testJournalOrder() {
        run.transition(JobStatus.RUNNING);
        run.append(JobLogEntry.info(null, "first"));
        run.onResult(result(2), progress());
        run.append(JobLogEntry.info(null, "last"));
        Job finished = run.finish(JobStatus.SUCCESS, JobSummary.builder().total(1).succeeded(1).build())
            .block(Duration.ofSeconds(5));

        assertEquals(1, finished.getSummary().getSucceeded());
        assertTrue(run.isPersisted());

        List<String> messages = store.logs("job-1").map(JobLogEntry::getMessage).collectList().block();
        assertEquals("first", messages.get(0));
        assertTrue(messages.get(1).startsWith("Completed in"));
        assertEquals("last", messages.get(2));
        assertEquals(1L, store.results("job-1").count().block().longValue());

        List<JobEvent> events = broadcast.eventsFor("job-1");
        assertEquals(JobStatus.RUNNING, events.get(0).getStatus());
        assertEquals(JobEvent.Type.STATUS, events.get(events.size() - 1).getType());
        assertEquals(JobStatus.SUCCESS, events.get(events.size() - 1).getStatus());
    }

    @Test
    @DisplayName("Should record a cancellation request once")
    void testRequestCancelIdempotent() {
        run.transition(JobStatus.RUNNING);
        run.requestCancel();
        run.requestCancel();

        assertTrue(run.isCancelRequested());
        assertEquals(1, run.logs().size());
    }

    @Test
    @DisplayName("Should cancel a queued job and keep it from starting afterwards")
    void testCancelIfQueued() {
        Job cancelled = run.cancelIfQueued().block(Duration.ofSeconds(5));

        assertNotNull(cancelled);
        assertEquals(JobStatus.CANCELLED, cancelled.getStatus());
        assertTrue(run.isCancelRequested());
        assertThrows(IllegalJobTransitionException.class, () -> run.transition(JobStatus.RUNNING));
        assertEquals(JobStatus.CANCELLED, store.get("job-1").block().getStatus());
    }

    @Test
    @DisplayName("Should leave a job that already started to the running cancellation path")
    void testCancelIfQueuedAfterStart() {
        run.transition(JobStatus.RUNNING);

        assertNull(run.cancelIfQueued().block(Duration.ofSeconds(5)));
        assertEquals(JobStatus.RUNNING, run.status());
        assertFalse(run.isCancelRequested());

        run.onResult(result(1), progress());
        assertEquals(1, run.details().getResults().size());
    }

    private static DeviceResult result(long deviceId) {
        Instant now = Instant.now();
        return DeviceResult.builder()
            .deviceId(deviceId)
            .hostname("sw-" + deviceId)
            .status(DeviceResultStatus.SUCCESS)
            .output("ok")
            .startedAt(now)
            .finishedAt(now)
            .build();
    }

    private static JobProgress progress() {
        return JobProgress.builder().total(1).completed(1).succeeded(1).build();
    }
}
