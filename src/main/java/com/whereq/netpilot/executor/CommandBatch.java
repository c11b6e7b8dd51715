package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.transport.TransportOperation;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Run a list of commands, in order
 */
@Value
public class CommandBatch implements WorkUnit {
    List<String> commands;

    @Override
    public JobType getKind() {
        return JobType.RUN_COMMANDS;
    }

    @Override
    public TransportRequest toRequest() {
        return TransportRequest.builder()
            .operation(TransportOperation.RUN_COMMANDS)
            .commands(commands)
            .build();
    }

    @Override
    public String render(TransportResponse response) {
        Map<String, String> outputs = response.getCommandOutputs();
        if (outputs == null || outputs.isEmpty()) {
            return response.getOutput() != null ? response.getOutput() : "";
        }
        StringBuilder sb = new StringBuilder();
        for (String command : commands) {
            sb.append("# ").append(command).append('\n');
            String output = outputs.get(command);
            if (output != null) {
                sb.append(output);
                if (!output.endsWith("\n")) {
                    sb.append('\n');
                }
            }
        }
        return sb.toString();
    }
}
