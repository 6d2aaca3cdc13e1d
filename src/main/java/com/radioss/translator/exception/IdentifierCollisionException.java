package com.radioss.translator.exception;

/**
 * Two entities of the same kind claimed the same identifier.
 */
public class IdentifierCollisionException extends TranslationException {

    private static final long serialVersionUID = 1L;

    public IdentifierCollisionException(String message) {
        super(message);
    }
}
