package com.modelgate.evaluation;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsEvaluatorTest {
    private static final double EPSILON = 1e-9;
    private final MetricsEvaluator evaluator = new MetricsEvaluator();

    @Test
    void shouldComputeMacroMetricsFromLabelOutput() {
        HoldoutDataset holdout = holdout(new int[] { 0, 0, 1, 1, 2, 2 });
        Predictor predictor = rows -> PredictionOutput.ofLabels(new int[] { 0, 1, 1, 1, 2, 0 });

        Metrics metrics = evaluator.score(predictor, holdout);

        // class 0: p=1/2 r=1/2, class 1: p=2/3 r=1, class 2: p=1 r=1/2
        assertEquals(4.0 / 6.0, metrics.accuracy(), EPSILON);
        assertEquals((0.5 + 2.0 / 3.0 + 1.0) / 3.0, metrics.precisionMacro(), EPSILON);
        assertEquals((0.5 + 1.0 + 0.5) / 3.0, metrics.recallMacro(), EPSILON);
        assertEquals((0.5 + 0.8 + 2.0 / 3.0) / 3.0, metrics.f1Macro(), EPSILON);
        assertNull(metrics.rocAucMacro());
        assertFalse(metrics.asMap().containsKey(Metrics.ROC_AUC_MACRO));
        assertEquals(4, metrics.asMap().size());
    }

    @Test
    void shouldPickMostProbableClassAndComputeAuc() {
        HoldoutDataset holdout = holdout(new int[] { 0, 1, 0, 1 });
        ClassProbabilities probabilities = new ClassProbabilities(new int[] { 0, 1 }, new double[][] {
                { 0.9, 0.1 },
                { 0.2, 0.8 },
                { 0.4, 0.6 },
                { 0.3, 0.7 } });
        Predictor predictor = rows -> PredictionOutput.ofProbabilities(probabilities);

        Metrics metrics = evaluator.score(predictor, holdout);

        assertEquals(0.75, metrics.accuracy(), EPSILON);
        assertTrue(metrics.rocAuc().isPresent());
        assertEquals(1.0, metrics.rocAucMacro(), EPSILON);
        assertTrue(metrics.asMap().containsKey(Metrics.ROC_AUC_MACRO));
    }

    @Test
    void shouldUseProbabilityCapabilityOfLabelPredictor() {
        HoldoutDataset holdout = holdout(new int[] { 0, 1, 0, 1 });
        Predictor predictor = new Predictor() {
            @Override
            public PredictionOutput predict(List<double[]> rows) {
                return PredictionOutput.ofLabels(new int[] { 0, 1, 1, 0 });
            }

            @Override
            public boolean exposesProbabilities() {
                return true;
            }

            @Override
            public ClassProbabilities predictProbabilities(List<double[]> rows) {
                return new ClassProbabilities(new int[] { 0, 1 }, new double[][] {
                        { 0.8, 0.2 }, { 0.3, 0.7 }, { 0.6, 0.4 }, { 0.5, 0.5 } });
            }
        };

        Metrics metrics = evaluator.score(predictor, holdout);

        assertEquals(0.5, metrics.accuracy(), EPSILON);
        // positives score 0.7 and 0.5, negatives 0.2 and 0.4 for class 1
        assertEquals(1.0, metrics.rocAucMacro(), EPSILON);
    }

    @Test
    void shouldOmitAucForSingleClassHoldout() {
        HoldoutDataset holdout = holdout(new int[] { 1, 1, 1 });
        ClassProbabilities probabilities = new ClassProbabilities(new int[] { 0, 1 }, new double[][] {
                { 0.1, 0.9 }, { 0.2, 0.8 }, { 0.6, 0.4 } });

        Metrics metrics = evaluator.score(rows -> PredictionOutput.ofProbabilities(probabilities), holdout);

        assertNull(metrics.rocAucMacro());
        assertEquals(2.0 / 3.0, metrics.accuracy(), EPSILON);
    }

    @Test
    void shouldOmitAucWhenHoldoutClassHasNoProbabilityColumn() {
        HoldoutDataset holdout = holdout(new int[] { 0, 1, 2 });
        ClassProbabilities probabilities = new ClassProbabilities(new int[] { 0, 1 }, new double[][] {
                { 0.9, 0.1 }, { 0.2, 0.8 }, { 0.5, 0.5 } });

        Metrics metrics = evaluator.score(rows -> PredictionOutput.ofProbabilities(probabilities), holdout);

        assertNull(metrics.rocAucMacro());
    }

    @Test
    void shouldAverageRanksForTiedScores() {
        double auc = MetricsEvaluator.binaryAuc(
                new double[] { 0.5, 0.5, 0.5, 0.5 },
                new boolean[] { true, false, true, false });

        assertEquals(0.5, auc, EPSILON);
    }

    @Test
    void shouldComputeThreeClassOneVsRestAuc() {
        int[] truth = { 0, 1, 2, 0 };
        ClassProbabilities probabilities = new ClassProbabilities(new int[] { 0, 1, 2 }, new double[][] {
                { 0.7, 0.2, 0.1 },
                { 0.2, 0.5, 0.3 },
                { 0.1, 0.6, 0.3 },
                { 0.3, 0.3, 0.4 } });

        Double auc = MetricsEvaluator.macroOvrAuc(truth, probabilities);

        // class 0: 1.0, class 1: 2/3, class 2: 1.5/3 with one tie
        assertEquals((1.0 + 2.0 / 3.0 + 0.5) / 3.0, auc, EPSILON);
    }

    @Test
    void shouldScoreZeroForClassNeverPredicted() {
        assertEquals(0.0, MetricsEvaluator.macroPrecision(new int[] { 1, 1 }, new int[] { 0, 0 }), EPSILON);
        assertEquals(0.0, MetricsEvaluator.macroF1(new int[] { 1, 1 }, new int[] { 0, 0 }), EPSILON);
    }

    @Test
    void shouldFailWhenPredictionCountDoesNotMatchLabels() {
        HoldoutDataset holdout = holdout(new int[] { 0, 1, 0 });

        assertThrows(EvaluationException.class,
                () -> evaluator.score(rows -> PredictionOutput.ofLabels(new int[] { 0, 1 }), holdout));
    }

    @Test
    void shouldFailWithoutPredictor() {
        assertThrows(EvaluationException.class, () -> evaluator.score(null, holdout(new int[] { 0 })));
    }

    @Test
    void shouldFailOnEmptyHoldout() {
        assertThrows(EvaluationException.class,
                () -> evaluator.score(rows -> PredictionOutput.ofLabels(new int[0]), holdout(new int[0])));
    }

    private static HoldoutDataset holdout(int[] labels) {
        double[][] rows = new double[labels.length][];
        for (int i = 0; i < labels.length; i++) {
            rows[i] = new double[] { i };
        }
        return new HoldoutDataset(List.of("x"), List.of(rows), labels);
    }
}
