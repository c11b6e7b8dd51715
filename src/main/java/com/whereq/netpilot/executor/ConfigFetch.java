package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.transport.TransportOperation;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;
import lombok.Value;

/**
 * Retrieve the running configuration for backup
 */
@Value
public class ConfigFetch implements WorkUnit {

    @Override
    public JobType getKind() {
        return JobType.BACKUP;
    }

    @Override
    public TransportRequest toRequest() {
        return TransportRequest.builder()
            .operation(TransportOperation.GET_CONFIG)
            .build();
    }

    @Override
    public String render(TransportResponse response) {
        return response.getOutput() != null ? response.getOutput() : "";
    }
}
