package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Value;

/**
 * {@code /BOX/RECTA} corners with the {@code /GRNOD/BOX} group collecting the nodes inside.
 */
@Value
public class BoxCard {
    int id;
    String name;
    List<Double> min;
    List<Double> max;
    int nodeGroupId;
}
