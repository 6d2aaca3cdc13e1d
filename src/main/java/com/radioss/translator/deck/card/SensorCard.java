package com.radioss.translator.deck.card;

import lombok.Value;

/**
 * Time sensor, active after {@code delay}.
 */
@Value
public class SensorCard {
    int id;
    String name;
    double delay;
}
