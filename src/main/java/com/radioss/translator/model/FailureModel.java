package com.radioss.translator.model;

import com.radioss.translator.exception.TranslationException;

import java.util.Locale;

/**
 * Damage laws that can be attached to a material as /FAIL cards.
 */
public enum FailureModel {
    JOHNSON,
    BIQUAD,
    TAB1;

    public String keyword() {
        return "/FAIL/" + name();
    }

    public static FailureModel fromName(String name) {
        if (name == null || name.isBlank()) {
            return JOHNSON;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("FAIL/")) {
            normalized = normalized.substring("FAIL/".length());
        }
        try {
            return FailureModel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new TranslationException("Unknown failure model: " + name, e);
        }
    }
}
