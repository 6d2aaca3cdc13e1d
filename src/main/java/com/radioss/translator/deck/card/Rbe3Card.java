package com.radioss.translator.deck.card;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Interpolation element. Independent nodes sharing a weight share one node group.
 */
@Value
@Builder
public class Rbe3Card {
    int id;
    String name;
    int dependentNodeId;
    String dof;
    @Singular
    List<WeightedGroup> groups;

    @Value
    public static class WeightedGroup {
        double weight;
        int nodeGroupId;
    }
}
