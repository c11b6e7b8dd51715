package com.whereq.netpilot.safety;

import lombok.Value;

/**
 * A command flagged by a rule
 */
@Value
public class CommandMatch {
    String command;
    String ruleName;
    CommandCategory category;
}
