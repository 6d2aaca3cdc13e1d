package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Value;

@Value
public class NodeGroupCard {
    int id;
    String name;
    List<Integer> nodeIds;
}
