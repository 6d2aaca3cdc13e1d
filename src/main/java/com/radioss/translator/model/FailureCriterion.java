package com.radioss.translator.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/**
 * Damage law attached to a material. Parameters may be empty when only the law name was declared.
 */
@Data
public class FailureCriterion {
    private final FailureModel model;
    private final Map<String, Double> parameters = new LinkedHashMap<>();

    public FailureCriterion(FailureModel model) {
        this.model = model;
    }

    public FailureCriterion(FailureModel model, Map<String, Double> parameters) {
        this.model = model;
        if (parameters != null) {
            this.parameters.putAll(parameters);
        }
    }
}
