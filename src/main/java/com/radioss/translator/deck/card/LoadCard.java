package com.radioss.translator.deck.card;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoadCard {
    int id;
    String name;
    LoadType type;
    int nodeGroupId;
    String direction;
    double value;

    /** 0 for initial velocities. */
    int functionId;
    int sensorId;
}
