package com.passpattern.generator.parser;

import java.util.List;

/**
 * Holds every structural problem found in a pattern.
 */
public class PatternValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public PatternValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
