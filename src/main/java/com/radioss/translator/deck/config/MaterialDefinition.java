package com.radioss.translator.deck.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Extra material added on top of (or instead of) the materials found in the export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MaterialDefinition {
    private Integer id;
    private String name;

    /** Law name, e.g. {@code LAW2} or {@code JOHNSON_COOK}. */
    private String law;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, Double> parameters = new LinkedHashMap<>();

    /** Plastic strain / yield stress points for the tabulated law. */
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<CurvePointDefinition> curve = new ArrayList<>();

    private FailureDefinition failure;
}
