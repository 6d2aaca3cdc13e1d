package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyDefinition {
    private Integer id;
    private String name;

    /** SHELL, SOLID, BEAM, TRUSS or SPRING. */
    @Builder.Default
    private String type = "SHELL";

    /** Shell thickness; ignored by the other families. */
    private Double thickness;
}
