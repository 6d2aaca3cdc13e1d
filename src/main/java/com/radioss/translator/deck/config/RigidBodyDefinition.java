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
 * Rigid body: a main node carrying the nodes of a selection and/or an explicit node list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RigidBodyDefinition {
    private Integer id;
    private String name;

    /** Main node; 0 or absent lets the solver place it at the centre of mass. */
    private Integer mainNode;

    private String selection;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Integer> nodes = new ArrayList<>();
}
