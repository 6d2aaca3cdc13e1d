package com.radioss.translator.deck.card;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BoundaryCard {
    int id;
    String name;
    BoundaryType type;
    int nodeGroupId;

    /** BCS only, e.g. {@code 111 000}. */
    String dof;

    /** Prescribed motion only. */
    String direction;
    double value;
    int functionId;
}
