package com.radioss.translator.mapping;

/**
 * Radioss property type (/PROP/&lt;family&gt;) an element keyword needs.
 */
public enum PropertyFamily {
    SHELL,
    SOLID,
    BEAM,
    TRUSS,
    SPRING
}
