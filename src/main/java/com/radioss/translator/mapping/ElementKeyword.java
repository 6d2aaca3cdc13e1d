package com.radioss.translator.mapping;

/**
 * Radioss element card keywords the mesh writer can emit.
 */
public enum ElementKeyword {
    SHELL(PropertyFamily.SHELL),
    SH3N(PropertyFamily.SHELL),
    BRICK(PropertyFamily.SOLID),
    BRIC20(PropertyFamily.SOLID),
    TETRA4(PropertyFamily.SOLID),
    TETRA10(PropertyFamily.SOLID),
    BEAM(PropertyFamily.BEAM),
    TRUSS(PropertyFamily.TRUSS),
    SPRING(PropertyFamily.SPRING);

    private final PropertyFamily family;

    ElementKeyword(PropertyFamily family) {
        this.family = family;
    }

    public PropertyFamily getFamily() {
        return family;
    }

    /**
     * Card header, e.g. {@code /SHELL}.
     */
    public String header() {
        return "/" + name();
    }
}
