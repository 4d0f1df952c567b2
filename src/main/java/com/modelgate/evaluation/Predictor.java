package com.modelgate.evaluation;

import java.util.List;

/**
 * Prediction capability of a loaded model version.
 */
public interface Predictor {
    /**
     * Raw model output for the given feature rows: either class labels or per-class probabilities.
     */
    PredictionOutput predict(List<double[]> rows);

    /**
     * Whether {@link #predictProbabilities(List)} is supported even when {@link #predict(List)} returns labels.
     */
    default boolean exposesProbabilities() {
        return false;
    }

    default ClassProbabilities predictProbabilities(List<double[]> rows) {
        throw new UnsupportedOperationException("predictor does not expose class probabilities");
    }
}
