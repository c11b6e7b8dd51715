package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;

/**
 * Work to perform against a single device. Each job type maps to one kind of unit,
 * and the executor handles every kind through this contract.
 */
public interface WorkUnit {
    /**
     * Job type this unit belongs to
     */
    JobType getKind();

    /**
     * Transport payload for this unit
     */
    TransportRequest toRequest();

    /**
     * Normalize a successful transport response into the text stored on the device result
     */
    String render(TransportResponse response);
}
