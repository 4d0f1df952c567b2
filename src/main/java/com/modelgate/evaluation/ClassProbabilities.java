package com.modelgate.evaluation;

import java.util.Arrays;

/**
 * Per-row class probabilities; column {@code j} of every row belongs to {@code classes[j]}.
 */
public record ClassProbabilities(int[] classes, double[][] values) {
    public ClassProbabilities {
        if (classes == null || classes.length == 0) {
            throw new IllegalArgumentException("classes must not be empty");
        }
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        for (double[] row : values) {
            if (row.length != classes.length) {
                throw new IllegalArgumentException("probability row width " + row.length
                        + " does not match class count " + classes.length);
            }
        }
    }

    public int rowCount() {
        return values.length;
    }

    public int columnOf(int label) {
        for (int i = 0; i < classes.length; i++) {
            if (classes[i] == label) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Label with the highest probability per row; the first column wins ties.
     */
    public int[] argmaxLabels() {
        int[] labels = new int[values.length];
        for (int row = 0; row < values.length; row++) {
            int best = 0;
            for (int col = 1; col < classes.length; col++) {
                if (values[row][col] > values[row][best]) {
                    best = col;
                }
            }
            labels[row] = classes[best];
        }
        return labels;
    }

    @Override
    public String toString() {
        return "ClassProbabilities[classes=" + Arrays.toString(classes) + ", rows=" + values.length + "]";
    }
}
