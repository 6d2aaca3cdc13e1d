package com.radioss.translator.deck.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Interpolation element: the dependent node moves with the weighted average of the independent nodes.
 * Nodes of {@code selection} take weight 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rbe3Definition {
    private Integer id;
    private String name;
    private Integer dependentNode;
    private String selection;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<WeightedNodeDefinition> independent = new ArrayList<>();

    @Builder.Default
    private String dof = "111 111";
}
