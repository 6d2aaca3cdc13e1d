package com.radioss.translator.deck;

/**
 * What was synthesized while assembling the deck.
 */
public enum CompletionKind {
    MATERIAL_PARAMETER,
    DEFAULT_MATERIAL,
    FAILURE_PARAMETER,
    MATERIAL_CURVE,
    MATERIAL_RENUMBERED,
    AUTO_PROPERTY
}
