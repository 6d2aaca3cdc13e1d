package com.radioss.translator.deck.card;

import java.util.Locale;

import com.radioss.translator.exception.TranslationException;

public enum ContactType {
    /** General node-to-surface contact. */
    TYPE7,
    /** Tied contact. */
    TYPE2;

    public static ContactType fromName(String name) {
        if (name == null || name.isBlank()) {
            return TYPE7;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "TYPE7", "7", "GENERAL" -> TYPE7;
            case "TYPE2", "2", "TIED" -> TYPE2;
            default -> throw new TranslationException("Unknown contact type: " + name);
        };
    }
}
