package com.whereq.netpilot.service;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.exception.ConfirmationRequiredException;
import com.whereq.netpilot.exception.QuotaExceededException;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.queue.JobQueue;
import com.whereq.netpilot.safety.CommandSafetyClassifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Admission control for job submissions.
 * Rejects submissions when the queue is full and gates dangerous commands behind confirmation.
 */
@Slf4j
@Service
public class AdmissionController {

    private final JobQueue jobQueue;
    private final CommandSafetyClassifier classifier;
    private final long maxQueueSize;

    private final Counter admittedCounter;
    private final Counter quotaRejectedCounter;
    private final Counter confirmationRejectedCounter;

    public AdmissionController(JobQueue jobQueue, CommandSafetyClassifier classifier,
                               NetPilotProperties properties, MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.classifier = classifier;
        this.maxQueueSize = properties.getQueue().getMaxSize();

        admittedCounter = Counter.builder("netpilot.admission.admitted")
            .description("Number of submissions admitted")
            .register(meterRegistry);

        quotaRejectedCounter = Counter.builder("netpilot.jobs.rejected")
            .description("Number of submissions rejected at admission")
            .tag("reason", "quota")
            .register(meterRegistry);

        confirmationRejectedCounter = Counter.builder("netpilot.jobs.rejected")
            .description("Number of submissions rejected at admission")
            .tag("reason", "confirmation")
            .register(meterRegistry);
    }

    /**
     * Admit a submission or fail with the reason it was rejected
     *
     * @param submission prepared submission
     * @return Mono that completes when the submission is admitted
     */
    public Mono<Void> admit(JobSubmission submission) {
        return Mono.fromRunnable(() -> checkConfirmation(submission))
            .then(jobQueue.isFull(maxQueueSize))
            .flatMap(isFull -> {
                if (isFull) {
                    quotaRejectedCounter.increment();
                    log.warn("Submission of {} job rejected: queue is full (size >= {})",
                        submission.getType().getWireName(), maxQueueSize);
                    return Mono.error(new QuotaExceededException("Job queue is full (" + maxQueueSize + " jobs)"));
                }
                admittedCounter.increment();
                return Mono.<Void>empty();
            });
    }

    private void checkConfirmation(JobSubmission submission) {
        if (submission.getType() != JobType.RUN_COMMANDS || submission.isConfirmed()) {
            return;
        }
        List<String> flagged = classifier.classify(submission.getPayload().getCommands());
        if (!flagged.isEmpty()) {
            confirmationRejectedCounter.increment();
            log.warn("Submission rejected: {} dangerous commands without confirmation {}", flagged.size(), flagged);
            throw new ConfirmationRequiredException(
                "Dangerous commands require confirm=true: " + String.join(", ", flagged), flagged);
        }
    }
}
