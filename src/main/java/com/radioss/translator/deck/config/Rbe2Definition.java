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
 * Rigid element: the secondary nodes follow the dofs of the main node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rbe2Definition {
    private Integer id;
    private String name;
    private Integer mainNode;
    private String selection;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Integer> nodes = new ArrayList<>();

    /** Constrained dofs of the secondary nodes, e.g. {@code 111 000}. */
    @Builder.Default
    private String dof = "111 111";
}
