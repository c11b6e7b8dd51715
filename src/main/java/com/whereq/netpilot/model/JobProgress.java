package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time progress snapshot of a running job
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobProgress {
    int total;
    int completed;
    int succeeded;
    int failed;
    int skipped;

    public int getPercentage() {
        return total == 0 ? 100 : (completed * 100) / total;
    }
}
