package com.radioss.translator.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structural fallback keyed on connectivity length.
 * Thresholds: 3 -> SH3N, 4 -> SHELL, 8 -> BRICK, 10 -> TETRA10, 20 -> BRIC20, anything else -> TETRA4.
 */
public final class NodeCountFallback implements ElementTypeFallback {

    private static final Map<Integer, ElementKeyword> DEFAULT_THRESHOLDS = Map.of(
            3, ElementKeyword.SH3N,
            4, ElementKeyword.SHELL,
            8, ElementKeyword.BRICK,
            10, ElementKeyword.TETRA10,
            20, ElementKeyword.BRIC20
    );

    private final Map<Integer, ElementKeyword> thresholds;
    private final ElementKeyword otherwise;

    public NodeCountFallback(Map<Integer, ElementKeyword> thresholds, ElementKeyword otherwise) {
        this.thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(thresholds, "thresholds")));
        this.otherwise = Objects.requireNonNull(otherwise, "otherwise");
    }

    public static NodeCountFallback standard() {
        return new NodeCountFallback(DEFAULT_THRESHOLDS, ElementKeyword.TETRA4);
    }

    @Override
    public ElementKeyword resolve(int nodeCount) {
        return thresholds.getOrDefault(nodeCount, otherwise);
    }
}
