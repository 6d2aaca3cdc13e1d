package com.radioss.translator.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps Ansys element routine numbers to Radioss element keywords.
 *
 * Table lookup wins; codes the table does not list go to the configured fallback,
 * so {@link #resolve(int, int)} never fails.
 */
public final class ElementTypeTable {

    private static final Map<Integer, ElementKeyword> ANSYS_CODES;

    static {
        Map<Integer, ElementKeyword> codes = new HashMap<>();
        // shells
        codes.put(181, ElementKeyword.SHELL);
        codes.put(163, ElementKeyword.SHELL);
        codes.put(63, ElementKeyword.SHELL);
        codes.put(43, ElementKeyword.SHELL);
        codes.put(41, ElementKeyword.SHELL);
        // solids
        codes.put(185, ElementKeyword.BRICK);
        codes.put(164, ElementKeyword.BRICK);
        codes.put(45, ElementKeyword.BRICK);
        codes.put(186, ElementKeyword.BRIC20);
        codes.put(95, ElementKeyword.BRIC20);
        codes.put(187, ElementKeyword.TETRA10);
        codes.put(92, ElementKeyword.TETRA10);
        codes.put(285, ElementKeyword.TETRA4);
        // line elements
        codes.put(188, ElementKeyword.BEAM);
        codes.put(189, ElementKeyword.BEAM);
        codes.put(4, ElementKeyword.BEAM);
        codes.put(180, ElementKeyword.TRUSS);
        codes.put(8, ElementKeyword.TRUSS);
        codes.put(14, ElementKeyword.SPRING);
        ANSYS_CODES = Collections.unmodifiableMap(codes);
    }

    private final Map<Integer, ElementKeyword> codes;
    private final ElementTypeFallback fallback;

    public ElementTypeTable(Map<Integer, ElementKeyword> codes, ElementTypeFallback fallback) {
        this.codes = Collections.unmodifiableMap(new HashMap<>(Objects.requireNonNull(codes, "codes")));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public static ElementTypeTable standard() {
        return new ElementTypeTable(ANSYS_CODES, NodeCountFallback.standard());
    }

    public static ElementTypeTable withFallback(ElementTypeFallback fallback) {
        return new ElementTypeTable(ANSYS_CODES, fallback);
    }

    public ElementKeyword resolve(int typeCode, int nodeCount) {
        ElementKeyword mapped = codes.get(typeCode);
        if (mapped != null) {
            return mapped;
        }
        return fallback.resolve(nodeCount);
    }

    /**
     * Table hit only, without the structural fallback.
     */
    public Optional<ElementKeyword> lookup(int typeCode) {
        return Optional.ofNullable(codes.get(typeCode));
    }

    public boolean isKnown(int typeCode) {
        return codes.containsKey(typeCode);
    }
}
