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
 * Nodal time history output ({@code /TH/NODE}) for the nodes of a selection and/or a node list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeHistoryDefinition {
    private Integer id;
    private String name;
    private String selection;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Integer> nodes = new ArrayList<>();

    /** Solver variable names; {@code DEF} is the default nodal set. */
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> variables = new ArrayList<>(List.of("DEF"));
}
