package com.radioss.translator.deck.card;

import java.util.Locale;

import com.radioss.translator.exception.TranslationException;

public enum LoadType {
    IMPVEL("/IMPVEL"),
    CLOAD("/CLOAD"),
    GRAVITY("/GRAV"),
    INIVEL("/INIVEL/TRA");

    private final String keyword;

    LoadType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /** Loads driven by a time function. */
    public boolean usesFunction() {
        return this != INIVEL;
    }

    /** Imposed velocities and concentrated loads also act on rotations (XX, YY, ZZ). */
    public boolean allowsRotation() {
        return this == IMPVEL || this == CLOAD;
    }

    public static LoadType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new TranslationException("Load type is required");
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "IMPVEL", "VELOCITY" -> IMPVEL;
            case "CLOAD", "FORCE" -> CLOAD;
            case "GRAV", "GRAVITY" -> GRAVITY;
            case "INIVEL", "INITIAL_VELOCITY" -> INIVEL;
            default -> throw new TranslationException("Unknown load type: " + name);
        };
    }
}
