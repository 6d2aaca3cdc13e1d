package com.radioss.translator.deck;

/**
 * Identifier pools of the target deck. Entity kinds sharing a space also share its running maximum.
 */
public enum NumberingSpace {
    /** Materials, properties, parts and subsets. */
    MODEL,
    NODE_GROUP,
    SURFACE,
    FUNCTION,
    BOUNDARY,
    INTERFACE,
    LOAD,
    SENSOR,
    BOX,
    RIGID_BODY,
    RBE2,
    RBE3,
    TIME_HISTORY
}
