package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Imposed velocity, concentrated force, gravity or initial velocity.
 * A load without a selection applies to every node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadDefinition {
    private String name;

    /** IMPVEL, CLOAD, GRAVITY or INIVEL. */
    private String type;

    private String selection;

    @Builder.Default
    private String direction = "X";

    private double value;

    /** Optional sensor name that activates the load. */
    private String sensor;
}
