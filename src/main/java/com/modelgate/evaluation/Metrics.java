package com.modelgate.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Fixed metric set for one model on one holdout. {@code rocAucMacro} is null when it could not be computed.
 */
public record Metrics(
        double accuracy,
        double precisionMacro,
        double recallMacro,
        double f1Macro,
        Double rocAucMacro) {

    public static final String ACCURACY = "accuracy";
    public static final String PRECISION_MACRO = "precision_macro";
    public static final String RECALL_MACRO = "recall_macro";
    public static final String F1_MACRO = "f1_macro";
    public static final String ROC_AUC_MACRO = "roc_auc_macro";

    public OptionalDouble rocAuc() {
        return rocAucMacro == null ? OptionalDouble.empty() : OptionalDouble.of(rocAucMacro);
    }

    /**
     * Flat report form; the AUC key is absent when the value is.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(ACCURACY, accuracy);
        map.put(PRECISION_MACRO, precisionMacro);
        map.put(RECALL_MACRO, recallMacro);
        map.put(F1_MACRO, f1Macro);
        if (rocAucMacro != null) {
            map.put(ROC_AUC_MACRO, rocAucMacro);
        }
        return map;
    }

    public static Metrics fromMap(Map<String, Double> map) {
        return new Metrics(
                map.getOrDefault(ACCURACY, 0.0),
                map.getOrDefault(PRECISION_MACRO, 0.0),
                map.getOrDefault(RECALL_MACRO, 0.0),
                map.getOrDefault(F1_MACRO, 0.0),
                map.get(ROC_AUC_MACRO));
    }
}
