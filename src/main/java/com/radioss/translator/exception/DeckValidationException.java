package com.radioss.translator.exception;

import java.util.List;

/**
 * Raised when the written starter fails the structural deck checks. Holds every problem found.
 */
public class DeckValidationException extends TranslationException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public DeckValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
