package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.transport.TransportOperation;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;
import lombok.Value;

/**
 * Read-only diff of a candidate snippet against the running configuration
 */
@Value
public class ConfigDiff implements WorkUnit {

    static final String NO_CHANGES = "No changes";

    String snippet;
    ConfigMode mode;

    @Override
    public JobType getKind() {
        return JobType.DEPLOY_PREVIEW;
    }

    @Override
    public TransportRequest toRequest() {
        return TransportRequest.builder()
            .operation(TransportOperation.COMPARE_CONFIG)
            .snippet(snippet)
            .mode(mode)
            .build();
    }

    @Override
    public String render(TransportResponse response) {
        String diff = response.getOutput();
        return diff == null || diff.isBlank() ? NO_CHANGES : diff;
    }
}
