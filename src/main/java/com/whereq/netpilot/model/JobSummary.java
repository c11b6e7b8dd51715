package com.whereq.netpilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-job target counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {
    private int total;
    private int succeeded;
    private int failed;
    private int skipped;

    /**
     * Devices whose configuration changed (backup jobs only)
     */
    private Integer changed;

    public static JobSummary empty() {
        return JobSummary.builder().build();
    }
}
