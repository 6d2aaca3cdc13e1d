package com.radioss.translator.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.Data;

/**
 * Material parameters keyed by the Ansys label (EX, NUXY, DENS, A, B, ...).
 * Records are completed with defaults at assembly time rather than rejected when partial.
 */
@Data
public class MaterialRecord {
    private final int id;
    private String name;
    private MaterialLaw law = MaterialLaw.LINEAR_ELASTIC;
    private final Map<String, Double> parameters = new LinkedHashMap<>();
    private final List<CurvePoint> curve = new ArrayList<>();
    private FailureCriterion failure;

    public MaterialRecord(int id) {
        this.id = id;
    }

    public Optional<Double> parameter(String key) {
        return Optional.ofNullable(parameters.get(key));
    }

    public double parameterOr(String key, double fallback) {
        return parameters.getOrDefault(key, fallback);
    }

    public void putParameter(String key, double value) {
        parameters.put(key, value);
    }

    /**
     * Upper-case parameter label. The major Poisson ratio PRXY is stored as NUXY:
     * the two coincide for isotropic materials.
     */
    public static String canonicalKey(String label) {
        String key = label.trim().toUpperCase(Locale.ROOT);
        return key.equals("PRXY") ? "NUXY" : key;
    }

    public boolean hasParameter(String key) {
        return parameters.containsKey(key);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : "MAT_" + id;
    }

    /**
     * Deep copy, so assembly-time completions never leak into the parsed model.
     */
    public MaterialRecord copy() {
        return withId(id);
    }

    public MaterialRecord withId(int newId) {
        MaterialRecord copy = new MaterialRecord(newId);
        copy.setName(name);
        copy.setLaw(law);
        copy.getParameters().putAll(parameters);
        copy.getCurve().addAll(curve);
        if (failure != null) {
            copy.setFailure(new FailureCriterion(failure.getModel(), failure.getParameters()));
        }
        return copy;
    }
}
