package com.whereq.netpilot.queue;

import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.QueuedJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InMemoryJobQueue.
 */
@DisplayName("InMemoryJobQueue Tests")
class InMemoryJobQueueTest {

    @Test
    @DisplayName("Should deliver jobs in order and drop withdrawn ones")
    void testWithdrawBeforeDelivery() {
        InMemoryJobQueue queue = new InMemoryJobQueue();
        queue.enqueue(job("job-1")).block();
        queue.enqueue(job("job-2")).block();
        queue.enqueue(job("job-3")).block();

        assertTrue(queue.withdraw("job-2").block());
        assertFalse(queue.withdraw("job-2").block());
        assertEquals(2L, queue.depth().block().longValue());

        StepVerifier.create(queue.consume().map(QueuedJob::getJobId).take(2))
            .expectNext("job-1", "job-3")
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertEquals(0L, queue.depth().block().longValue());
        assertFalse(queue.withdraw("job-1").block());
    }

    @Test
    @DisplayName("Should report full once the depth reaches the limit")
    void testIsFull() {
        InMemoryJobQueue queue = new InMemoryJobQueue();
        queue.enqueue(job("job-1")).block();

        assertTrue(queue.isFull(1).block());
        assertFalse(queue.isFull(2).block());
    }

    private static QueuedJob job(String id) {
        return QueuedJob.builder()
            .jobId(id)
            .tenantId("acme")
            .type(JobType.RUN_COMMANDS)
            .enqueuedAt(Instant.now())
            .build();
    }
}
