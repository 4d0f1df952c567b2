package com.modelgate.evaluation;

import java.util.Arrays;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a predictor against a labelled holdout.
 *
 * <p>Accuracy and macro precision, recall and F1 are always produced. Macro one-vs-rest ROC-AUC is produced only
 * when the predictor exposes class probabilities and the holdout contains at least two classes, each with a
 * probability column; otherwise the AUC is left empty and the remaining metrics are still returned.
 */
public class MetricsEvaluator {
    private static final Logger log = LoggerFactory.getLogger(MetricsEvaluator.class);

    public Metrics score(Predictor predictor, HoldoutDataset holdout) {
        if (predictor == null) {
            throw new EvaluationException("No predictor available to score");
        }
        if (holdout == null || holdout.size() == 0) {
            throw new EvaluationException("Holdout dataset is empty");
        }

        PredictionOutput output;
        try {
            output = predictor.predict(holdout.rows());
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Predictor rejected holdout features: " + e.getMessage(), e);
        }
        int[] truth = holdout.labels();
        if (output == null || output.size() != truth.length) {
            throw new EvaluationException("Prediction count " + (output == null ? 0 : output.size())
                    + " does not match label count " + truth.length);
        }
        int[] predicted = output.predictedLabels();

        ClassProbabilities probabilities = null;
        if (output.hasProbabilities()) {
            probabilities = output.probabilities();
        } else if (predictor.exposesProbabilities()) {
            probabilities = predictor.predictProbabilities(holdout.rows());
        }

        return new Metrics(
                accuracy(truth, predicted),
                macroPrecision(truth, predicted),
                macroRecall(truth, predicted),
                macroF1(truth, predicted),
                probabilities == null ? null : macroOvrAuc(truth, probabilities));
    }

    static double accuracy(int[] truth, int[] predicted) {
        int correct = 0;
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] == predicted[i]) {
                correct++;
            }
        }
        return (double) correct / truth.length;
    }

    static double macroPrecision(int[] truth, int[] predicted) {
        int[] labels = labelUnion(truth, predicted);
        double sum = 0.0;
        for (int label : labels) {
            sum += precision(truth, predicted, label);
        }
        return sum / labels.length;
    }

    static double macroRecall(int[] truth, int[] predicted) {
        int[] labels = labelUnion(truth, predicted);
        double sum = 0.0;
        for (int label : labels) {
            sum += recall(truth, predicted, label);
        }
        return sum / labels.length;
    }

    static double macroF1(int[] truth, int[] predicted) {
        int[] labels = labelUnion(truth, predicted);
        double sum = 0.0;
        for (int label : labels) {
            double p = precision(truth, predicted, label);
            double r = recall(truth, predicted, label);
            sum += p + r == 0.0 ? 0.0 : 2 * p * r / (p + r);
        }
        return sum / labels.length;
    }

    private static double precision(int[] truth, int[] predicted, int label) {
        int truePositive = 0;
        int predictedPositive = 0;
        for (int i = 0; i < truth.length; i++) {
            if (predicted[i] == label) {
                predictedPositive++;
                if (truth[i] == label) {
                    truePositive++;
                }
            }
        }
        return predictedPositive == 0 ? 0.0 : (double) truePositive / predictedPositive;
    }

    private static double recall(int[] truth, int[] predicted, int label) {
        int truePositive = 0;
        int actualPositive = 0;
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] == label) {
                actualPositive++;
                if (predicted[i] == label) {
                    truePositive++;
                }
            }
        }
        return actualPositive == 0 ? 0.0 : (double) truePositive / actualPositive;
    }

    private static int[] labelUnion(int[] truth, int[] predicted) {
        TreeSet<Integer> labels = new TreeSet<>();
        Arrays.stream(truth).forEach(labels::add);
        Arrays.stream(predicted).forEach(labels::add);
        return labels.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Mean of the one-vs-rest AUCs over the classes present in the holdout, or null when not computable.
     */
    static Double macroOvrAuc(int[] truth, ClassProbabilities probabilities) {
        if (probabilities.rowCount() != truth.length) {
            log.debug("evaluation.auc.skipped reason=row-mismatch rows={} labels={}", probabilities.rowCount(), truth.length);
            return null;
        }
        int[] present = Arrays.stream(truth).distinct().sorted().toArray();
        if (present.length < 2) {
            log.debug("evaluation.auc.skipped reason=single-class class={}", present.length == 0 ? "none" : present[0]);
            return null;
        }
        double sum = 0.0;
        for (int label : present) {
            int column = probabilities.columnOf(label);
            if (column < 0) {
                log.debug("evaluation.auc.skipped reason=missing-probability-column class={}", label);
                return null;
            }
            double[] scores = new double[truth.length];
            boolean[] positive = new boolean[truth.length];
            for (int i = 0; i < truth.length; i++) {
                scores[i] = probabilities.values()[i][column];
                positive[i] = truth[i] == label;
            }
            sum += binaryAuc(scores, positive);
        }
        return sum / present.length;
    }

    /**
     * Rank-sum (Mann-Whitney) AUC with average ranks for tied scores.
     */
    static double binaryAuc(double[] scores, boolean[] positive) {
        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(scores[a], scores[b]));

        double[] ranks = new double[scores.length];
        int i = 0;
        while (i < order.length) {
            int j = i;
            while (j + 1 < order.length && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = averageRank;
            }
            i = j + 1;
        }

        long positives = 0;
        double positiveRankSum = 0.0;
        for (int k = 0; k < scores.length; k++) {
            if (positive[k]) {
                positives++;
                positiveRankSum += ranks[k];
            }
        }
        long negatives = scores.length - positives;
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }
}
