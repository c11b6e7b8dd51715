package com.whereq.netpilot.service;

import com.whereq.netpilot.handler.JobHandler;
import com.whereq.netpilot.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for selecting the handler of a job type
 */
@Slf4j
@Service
public class ExecutionStrategyFactory {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public ExecutionStrategyFactory(List<JobHandler> jobHandlers) {
        for (JobHandler handler : jobHandlers) {
            JobHandler previous = handlers.put(handler.getType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.getType() + ": "
                    + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered job handlers for {}", handlers.keySet());
    }

    /**
     * Select the handler for a job type
     *
     * @param type the job type
     * @return selected handler
     */
    public JobHandler selectHandler(JobType type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type is required");
        }
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new IllegalArgumentException("Unsupported job type: " + type.getWireName());
        }
        return handler;
    }
}
