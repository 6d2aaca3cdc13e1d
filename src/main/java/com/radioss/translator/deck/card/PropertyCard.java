package com.radioss.translator.deck.card;

import com.radioss.translator.mapping.PropertyFamily;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PropertyCard {
    int id;
    String name;
    PropertyFamily family;

    /** Shell thickness. */
    @Builder.Default
    double thickness = 1.0;
}
