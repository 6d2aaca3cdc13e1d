package com.radioss.translator.parser;

import java.util.Locale;

/**
 * Tagged classification of a CDB line. Anything the translator does not need falls into {@link #IGNORE}.
 */
public enum BlockKind {
    ELEMENT_TYPE,
    ELEMENT_TYPE_TABLE,
    NODE,
    ELEMENT,
    SELECTION,
    MATERIAL,
    MATERIAL_TABLE,
    IGNORE;

    /**
     * Classify a raw input line. Only header lines map to something other than {@link #IGNORE}.
     */
    public static BlockKind classify(String line) {
        if (line == null) {
            return IGNORE;
        }
        String t = line.trim().toUpperCase(Locale.ROOT);
        if (t.isEmpty() || !Character.isLetter(t.charAt(0))) {
            return IGNORE;
        }
        if (t.startsWith("NBLOCK")) {
            return NODE;
        }
        if (t.startsWith("EBLOCK")) {
            return ELEMENT;
        }
        if (t.startsWith("CMBLOCK")) {
            return SELECTION;
        }
        if (t.startsWith("ETBLOCK")) {
            return ELEMENT_TYPE_TABLE;
        }
        if (t.startsWith("ET,")) {
            return ELEMENT_TYPE;
        }
        if (t.startsWith("MPDATA")) {
            return MATERIAL;
        }
        if (t.startsWith("TB,")) {
            return MATERIAL_TABLE;
        }
        return IGNORE;
    }
}
