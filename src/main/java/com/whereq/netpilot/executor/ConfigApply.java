package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.transport.TransportOperation;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;
import lombok.Value;

/**
 * Apply a previewed snippet and commit it on the device
 */
@Value
public class ConfigApply implements WorkUnit {
    String snippet;
    ConfigMode mode;

    @Override
    public JobType getKind() {
        return JobType.DEPLOY_COMMIT;
    }

    @Override
    public TransportRequest toRequest() {
        return TransportRequest.builder()
            .operation(TransportOperation.APPLY_CONFIG)
            .snippet(snippet)
            .mode(mode)
            .build();
    }

    @Override
    public String render(TransportResponse response) {
        return response.getOutput() != null && !response.getOutput().isBlank() ? response.getOutput() : "Committed";
    }
}
