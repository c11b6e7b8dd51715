package com.whereq.netpilot.safety;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * One entry of the dangerous command table. The expression is matched case-insensitively
 * against the start of the trimmed command and must end on a word boundary.
 */
@Value
public class CommandRule {
    String name;
    CommandCategory category;
    String expression;
    Pattern pattern;

    public static CommandRule of(String name, CommandCategory category, String expression) {
        Pattern compiled = Pattern.compile("^(?:" + expression + ")(?=\\s|$)", Pattern.CASE_INSENSITIVE);
        return new CommandRule(name, category, expression, compiled);
    }

    public boolean matches(String command) {
        return command != null && pattern.matcher(command.trim()).find();
    }
}
