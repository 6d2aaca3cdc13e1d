package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Value;

@Value
public class TimeHistoryCard {
    int id;
    String name;
    List<String> variables;
    List<Integer> nodeIds;
}
