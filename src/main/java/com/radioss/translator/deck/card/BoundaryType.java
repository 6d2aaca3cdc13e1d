package com.radioss.translator.deck.card;

import java.util.Locale;

import com.radioss.translator.exception.TranslationException;

public enum BoundaryType {
    /** /BCS: fixed degrees of freedom. */
    BCS,
    /** /BOUNDARY/PRESCRIBED_MOTION. */
    PRESCRIBED_MOTION;

    public static BoundaryType fromName(String name) {
        if (name == null || name.isBlank()) {
            return BCS;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "BCS", "FIXED" -> BCS;
            case "PRESCRIBED_MOTION", "MOTION" -> PRESCRIBED_MOTION;
            default -> throw new TranslationException("Unknown boundary condition type: " + name);
        };
    }
}
