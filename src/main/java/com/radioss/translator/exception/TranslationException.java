package com.radioss.translator.exception;

/**
 * Base type for every failure raised while translating a CDB export into a Radioss deck.
 */
public class TranslationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
