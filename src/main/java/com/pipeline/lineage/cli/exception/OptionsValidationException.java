package com.pipeline.lineage.cli.exception;

import java.util.List;

/**
 * All option problems of one command invocation, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super("Invalid options for '" + command + "': " + String.join("; ", errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }

    public String getCommand() {
        return command;
    }

    public List<String> getErrors() {
        return errors;
    }
}
