package com.eda.defparser.cli.exception;

import java.util.List;

/**
 * Raised by the options validator with every problem found in the parse-def
 * options, so they can be reported together before any parsing starts.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Validation messages in the order they were found.
     */
    public List<String> getErrors() {
        return errors;
    }
}
