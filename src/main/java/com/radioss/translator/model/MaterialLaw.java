package com.radioss.translator.model;

import java.util.Locale;

/**
 * Radioss material law families the translator knows how to write.
 */
public enum MaterialLaw {
    /** /MAT/LAW1 (ELAST). */
    LINEAR_ELASTIC(1),
    /** /MAT/LAW2 (PLAS_JOHNS). */
    JOHNSON_COOK(2),
    /** /MAT/LAW27 (PLAS_BRIT). */
    PLASTIC_BRITTLE(27),
    /** /MAT/LAW36 (PLAS_TAB). */
    TABULATED_PLASTIC(36),
    /** /MAT/LAW44 (COWPER). */
    COWPER_SYMONDS(44);

    private final int lawNumber;

    MaterialLaw(int lawNumber) {
        this.lawNumber = lawNumber;
    }

    public int getLawNumber() {
        return lawNumber;
    }

    public String keyword() {
        return "LAW" + lawNumber;
    }

    /**
     * Accepts both the Radioss name ("LAW2") and descriptive aliases ("JOHNSON_COOK", "plastic").
     * Unknown names fall back to the linear elastic law.
     */
    public static MaterialLaw fromName(String name) {
        if (name == null || name.isBlank()) {
            return LINEAR_ELASTIC;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "LAW2", "JOHNSON_COOK", "PLAS_JOHNS", "PLASTIC" -> JOHNSON_COOK;
            case "LAW27", "PLASTIC_BRITTLE", "PLAS_BRIT" -> PLASTIC_BRITTLE;
            case "LAW36", "TABULATED_PLASTIC", "PLAS_TAB" -> TABULATED_PLASTIC;
            case "LAW44", "COWPER_SYMONDS", "COWPER" -> COWPER_SYMONDS;
            default -> LINEAR_ELASTIC;
        };
    }
}
