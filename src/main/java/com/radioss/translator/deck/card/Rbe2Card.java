package com.radioss.translator.deck.card;

import lombok.Value;

@Value
public class Rbe2Card {
    int id;
    String name;
    int mainNodeId;
    String dof;
    int nodeGroupId;
}
