package com.whereq.netpilot.dto;

import com.whereq.netpilot.safety.CommandMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Classification result; only flagged commands are listed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyResponse {

    private String ruleSetVersion;

    /**
     * True when at least one command needs confirmation
     */
    private boolean confirmationRequired;

    private List<CommandMatch> flagged;
}
