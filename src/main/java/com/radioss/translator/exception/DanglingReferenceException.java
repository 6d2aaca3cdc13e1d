package com.radioss.translator.exception;

/**
 * An element, selection or card points at an identifier that does not exist
 * in the entity set it refers to.
 */
public class DanglingReferenceException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String entityKind;
    private final long missingId;

    public DanglingReferenceException(String entityKind, long missingId, String message) {
        super(message);
        this.entityKind = entityKind;
        this.missingId = missingId;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public long getMissingId() {
        return missingId;
    }
}
