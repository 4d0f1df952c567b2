package com.modelgate.evaluation;

/**
 * Raw output of {@link Predictor#predict}. Exactly one of {@code labels} and {@code probabilities} is set.
 */
public record PredictionOutput(int[] labels, ClassProbabilities probabilities) {
    public PredictionOutput {
        if ((labels == null) == (probabilities == null)) {
            throw new IllegalArgumentException("exactly one of labels or probabilities must be provided");
        }
    }

    public static PredictionOutput ofLabels(int[] labels) {
        return new PredictionOutput(labels, null);
    }

    public static PredictionOutput ofProbabilities(ClassProbabilities probabilities) {
        return new PredictionOutput(null, probabilities);
    }

    public boolean hasProbabilities() {
        return probabilities != null;
    }

    public int size() {
        return hasProbabilities() ? probabilities.rowCount() : labels.length;
    }

    public int[] predictedLabels() {
        return hasProbabilities() ? probabilities.argmaxLabels() : labels;
    }
}
