package com.radioss.translator.mapping;

/**
 * Decides a keyword for element type codes the table does not know.
 * Implementations must be pure and must always return a keyword.
 */
@FunctionalInterface
public interface ElementTypeFallback {

    ElementKeyword resolve(int nodeCount);
}
