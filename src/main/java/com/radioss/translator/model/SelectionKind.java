package com.radioss.translator.model;

/**
 * What a named selection groups.
 */
public enum SelectionKind {
    NODE,
    ELEMENT;

    public static SelectionKind fromCdb(String entity) {
        if (entity == null) {
            return null;
        }
        return switch (entity.trim().toUpperCase()) {
            case "NODE" -> NODE;
            case "ELEM", "ELEMENT" -> ELEMENT;
            default -> null;
        };
    }
}
