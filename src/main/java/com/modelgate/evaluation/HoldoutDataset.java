package com.modelgate.evaluation;

import java.util.List;

public record HoldoutDataset(List<String> featureNames, List<double[]> rows, int[] labels) {
    public HoldoutDataset {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        rows = rows == null ? List.of() : List.copyOf(rows);
        labels = labels == null ? new int[0] : labels;
    }

    public int size() {
        return labels.length;
    }
}
