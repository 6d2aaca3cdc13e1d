package com.radioss.translator.deck;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.radioss.translator.model.CurvePoint;
import com.radioss.translator.model.FailureCriterion;
import com.radioss.translator.model.FailureModel;
import com.radioss.translator.model.MaterialLaw;
import com.radioss.translator.model.MaterialRecord;

/**
 * Structural steel reference values used to complete partial materials.
 * Only absent keys are filled and every filled value is reported.
 */
public final class MaterialDefaults {

    public static final double YOUNG_MODULUS = 210000.0;
    public static final double POISSON_RATIO = 0.3;
    public static final double DENSITY = 7800.0;

    public static final String DEFAULT_MATERIAL_NAME = "DEFAULT_STEEL";

    private static final Map<String, Double> ELASTIC = ordered(
            "EX", YOUNG_MODULUS,
            "NUXY", POISSON_RATIO,
            "DENS", DENSITY);

    private static final Map<MaterialLaw, Map<String, Double>> LAW_PARAMETERS = new EnumMap<>(MaterialLaw.class);
    private static final Map<FailureModel, Map<String, Double>> FAILURE_PARAMETERS = new EnumMap<>(FailureModel.class);

    static {
        LAW_PARAMETERS.put(MaterialLaw.LINEAR_ELASTIC, Map.of());
        LAW_PARAMETERS.put(MaterialLaw.JOHNSON_COOK, ordered(
                "A", 220.0, "B", 450.0, "N", 0.36, "C", 0.01, "EPS0", 1.0));
        LAW_PARAMETERS.put(MaterialLaw.PLASTIC_BRITTLE, ordered(
                "SIG0", 250.0, "SU", 500.0, "EPSU", 0.2));
        LAW_PARAMETERS.put(MaterialLaw.TABULATED_PLASTIC, ordered(
                "Fsmooth", 0.0, "Fcut", 0.0, "Chard", 1.0));
        LAW_PARAMETERS.put(MaterialLaw.COWPER_SYMONDS, ordered(
                "A", 6500.0, "B", 4.0, "N", 1.0, "C", 0.0));

        // DP600-type sheet steel
        FAILURE_PARAMETERS.put(FailureModel.JOHNSON, ordered(
                "D1", 0.54, "D2", 3.03, "D3", -2.12, "D4", 0.002, "D5", 0.61));
        FAILURE_PARAMETERS.put(FailureModel.BIQUAD, ordered(
                "C1", 0.9, "C2", 2.0, "C3", 2.0));
        FAILURE_PARAMETERS.put(FailureModel.TAB1, ordered(
                "Dcrit", 1.0));
    }

    private MaterialDefaults() {
    }

    public static Map<String, Double> failureParameters(FailureModel model) {
        return FAILURE_PARAMETERS.get(model);
    }

    /**
     * Generic linear elastic steel for a part whose material is undefined.
     */
    public static MaterialRecord defaultMaterial(int id) {
        MaterialRecord record = new MaterialRecord(id);
        record.setName(DEFAULT_MATERIAL_NAME);
        record.setLaw(MaterialLaw.LINEAR_ELASTIC);
        ELASTIC.forEach(record::putParameter);
        return record;
    }

    /**
     * Fills the elastic constants, the law parameters, the hardening curve of a tabulated law
     * and the coefficients of an attached damage law.
     */
    public static void complete(MaterialRecord record, CompletionReport report) {
        fill(record.getParameters(), ELASTIC, CompletionKind.MATERIAL_PARAMETER, record.getId(), report);
        fill(record.getParameters(), LAW_PARAMETERS.get(record.getLaw()), CompletionKind.MATERIAL_PARAMETER,
                record.getId(), report);

        if (record.getLaw() == MaterialLaw.TABULATED_PLASTIC && record.getCurve().isEmpty()) {
            record.getCurve().add(new CurvePoint(0.0, 250.0));
            record.getCurve().add(new CurvePoint(1.0, 500.0));
            report.add(CompletionKind.MATERIAL_CURVE, record.getId(), "reference hardening curve (0.0, 250.0) (1.0, 500.0)");
        }

        FailureCriterion failure = record.getFailure();
        if (failure != null) {
            fill(failure.getParameters(), FAILURE_PARAMETERS.get(failure.getModel()), CompletionKind.FAILURE_PARAMETER,
                    record.getId(), report);
        }
    }

    private static void fill(Map<String, Double> target, Map<String, Double> defaults, CompletionKind kind,
            int id, CompletionReport report) {
        for (Map.Entry<String, Double> entry : defaults.entrySet()) {
            if (!containsIgnoreCase(target, entry.getKey())) {
                target.put(entry.getKey(), entry.getValue());
                report.add(kind, id, entry.getKey() + "=" + CardFormat.number(entry.getValue()));
            }
        }
    }

    private static boolean containsIgnoreCase(Map<String, Double> map, String key) {
        return map.keySet().stream().anyMatch(k -> k.equalsIgnoreCase(key));
    }

    private static Map<String, Double> ordered(Object... keyValues) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (Double) keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
