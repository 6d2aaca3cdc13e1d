package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Value;

/**
 * Element group a part refers to by a single identifier.
 */
@Value
public class SubsetCard {
    int id;
    String name;
    List<Integer> elementIds;
}
