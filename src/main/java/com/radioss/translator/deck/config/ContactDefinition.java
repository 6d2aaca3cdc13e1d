package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contact interface between a secondary node selection and a main element selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContactDefinition {
    private String name;

    /** TYPE7 (general) or TYPE2 (tied). */
    @Builder.Default
    private String type = "TYPE7";

    private String secondary;
    private String main;

    @Builder.Default
    private double friction = 0.0;

    /** Minimum gap, TYPE7 only. */
    @Builder.Default
    private double gap = 0.0;
}
