package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A part links an element selection to a property and a material.
 * Undefined properties and materials are completed at assembly time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartDefinition {
    private Integer id;
    private String name;
    private Integer property;
    private Integer material;

    /** Element selection name; the whole mesh when absent. */
    private String selection;
}
