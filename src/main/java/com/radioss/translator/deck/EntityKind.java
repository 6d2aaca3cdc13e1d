package com.radioss.translator.deck;

/**
 * Entities that carry a numeric identifier in the target deck.
 */
public enum EntityKind {
    MATERIAL(NumberingSpace.MODEL),
    PROPERTY(NumberingSpace.MODEL),
    PART(NumberingSpace.MODEL),
    SUBSET(NumberingSpace.MODEL),
    NODE_GROUP(NumberingSpace.NODE_GROUP),
    SURFACE(NumberingSpace.SURFACE),
    FUNCTION(NumberingSpace.FUNCTION),
    BOUNDARY(NumberingSpace.BOUNDARY),
    INTERFACE(NumberingSpace.INTERFACE),
    LOAD(NumberingSpace.LOAD),
    SENSOR(NumberingSpace.SENSOR),
    BOX(NumberingSpace.BOX),
    RIGID_BODY(NumberingSpace.RIGID_BODY),
    RBE2(NumberingSpace.RBE2),
    RBE3(NumberingSpace.RBE3),
    TIME_HISTORY(NumberingSpace.TIME_HISTORY);

    private final NumberingSpace space;

    EntityKind(NumberingSpace space) {
        this.space = space;
    }

    public NumberingSpace getSpace() {
        return space;
    }
}
