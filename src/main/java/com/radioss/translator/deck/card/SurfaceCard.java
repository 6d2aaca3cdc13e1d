package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Value;

/**
 * Segment surface; each segment lists four nodes, triangles repeat the third.
 */
@Value
public class SurfaceCard {
    int id;
    String name;
    List<List<Integer>> segments;
}
