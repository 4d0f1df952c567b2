package com.modelgate.artifact;

import java.util.List;

import com.modelgate.evaluation.ClassProbabilities;
import com.modelgate.evaluation.PredictionOutput;
import com.modelgate.evaluation.Predictor;

public class LinearPredictor implements Predictor {
    private final int[] classes;
    private final double[][] weights;
    private final double[] intercepts;
    private final boolean softmax;

    public LinearPredictor(int[] classes, double[][] weights, double[] intercepts, boolean softmax) {
        this.classes = classes.clone();
        this.weights = weights;
        this.intercepts = intercepts.clone();
        this.softmax = softmax;
    }

    public int featureCount() {
        return weights[0].length;
    }

    @Override
    public PredictionOutput predict(List<double[]> rows) {
        if (softmax) {
            return PredictionOutput.ofProbabilities(predictProbabilities(rows));
        }
        int[] labels = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double[] scores = scores(rows.get(i));
            int best = 0;
            for (int k = 1; k < scores.length; k++) {
                if (scores[k] > scores[best]) {
                    best = k;
                }
            }
            labels[i] = classes[best];
        }
        return PredictionOutput.ofLabels(labels);
    }

    @Override
    public boolean exposesProbabilities() {
        return softmax;
    }

    @Override
    public ClassProbabilities predictProbabilities(List<double[]> rows) {
        if (!softmax) {
            return Predictor.super.predictProbabilities(rows);
        }
        double[][] values = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = softmax(scores(rows.get(i)));
        }
        return new ClassProbabilities(classes, values);
    }

    private double[] scores(double[] row) {
        if (row.length != featureCount()) {
            throw new IllegalArgumentException("expected " + featureCount() + " features but row has " + row.length);
        }
        double[] scores = new double[classes.length];
        for (int k = 0; k < classes.length; k++) {
            double sum = intercepts[k];
            for (int j = 0; j < row.length; j++) {
                sum += weights[k][j] * row[j];
            }
            scores[k] = sum;
        }
        return scores;
    }

    private static double[] softmax(double[] scores) {
        double max = Double.NEGATIVE_INFINITY;
        for (double score : scores) {
            max = Math.max(max, score);
        }
        double total = 0.0;
        double[] out = new double[scores.length];
        for (int k = 0; k < scores.length; k++) {
            out[k] = Math.exp(scores[k] - max);
            total += out[k];
        }
        for (int k = 0; k < out.length; k++) {
            out[k] /= total;
        }
        return out;
    }
}
