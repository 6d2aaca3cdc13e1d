package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed dofs ({@code BCS}) or a prescribed motion on the nodes of a selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoundaryConditionDefinition {
    private String name;

    @Builder.Default
    private String type = "BCS";

    private String selection;

    /** Translation and rotation flags, e.g. {@code 111 000}. */
    @Builder.Default
    private String dof = "111 111";

    /** Prescribed motion only. */
    @Builder.Default
    private String direction = "X";
    private Double value;
}
