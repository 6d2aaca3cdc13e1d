package com.radioss.translator.deck.card;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PartCard {
    int id;
    String name;
    int propertyId;
    int materialId;

    /** 0 when the part covers the whole mesh. */
    int subsetId;
}
