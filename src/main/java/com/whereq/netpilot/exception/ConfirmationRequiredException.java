package com.whereq.netpilot.exception;

import java.util.List;

/**
 * Thrown when a submission contains dangerous commands, or commits a change, without explicit confirmation
 */
public class ConfirmationRequiredException extends RuntimeException {

    private final List<String> flaggedCommands;

    public ConfirmationRequiredException(String message, List<String> flaggedCommands) {
        super(message);
        this.flaggedCommands = List.copyOf(flaggedCommands);
    }

    public List<String> getFlaggedCommands() {
        return flaggedCommands;
    }
}
