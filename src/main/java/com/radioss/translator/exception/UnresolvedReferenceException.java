package com.radioss.translator.exception;

/**
 * A configured card names a selection (or sensor) that the model does not define.
 */
public class UnresolvedReferenceException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String referenceName;

    public UnresolvedReferenceException(String referenceName, String message) {
        super(message);
        this.referenceName = referenceName;
    }

    public String getReferenceName() {
        return referenceName;
    }
}
