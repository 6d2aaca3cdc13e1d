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
 * Axis-aligned box whose nodes the solver collects into a node group.
 * Boundary conditions, loads and contacts may name the box like a selection.
 *
 * <pre>{@code
 * boxes:
 *   - name: base_box
 *     min: [0.0, 0.0, -0.1]
 *     max: [1.0, 1.0, 0.1]
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoxDefinition {
    private Integer id;
    private String name;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Double> min = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Double> max = new ArrayList<>();
}
