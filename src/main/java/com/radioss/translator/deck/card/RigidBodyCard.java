package com.radioss.translator.deck.card;

import lombok.Value;

@Value
public class RigidBodyCard {
    int id;
    String name;

    /** 0 when the solver places the main node at the centre of mass. */
    int mainNodeId;
    int nodeGroupId;
}
