package com.thriftgen.generator.cli.exception;

import java.util.List;

/**
 * Invalid check-fragments options. Carries every problem found so one run reports them all.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid options (" + errors.size() + "): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
