package com.modelgate.promotion;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.modelgate.evaluation.Metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromotionPolicyTest {
    private final PromotionPolicy policy = new PromotionPolicy();

    @Test
    void shouldPromoteCandidateThatBeatsChampionAndPassesGates() {
        PromotionDecision decision = policy.decide(
                metrics(0.95, 0.93),
                metrics(0.92, 0.90),
                new GateThresholds(0.90, 0.90));

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
        assertTrue(decision.reasons().isEmpty());
    }

    @Test
    void shouldRejectFirstCandidateBelowGates() {
        PromotionDecision decision = policy.decide(
                metrics(0.85, 0.80),
                null,
                new GateThresholds(0.90, 0.80));

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(Set.of(ReasonCode.FAILED_GATES), decision.reasons());
        assertEquals(List.of("failed_gates"), decision.reasonCodes());
    }

    @Test
    void shouldRejectCandidateWorseThanChampion() {
        PromotionDecision decision = policy.decide(
                metrics(0.93, 0.88),
                metrics(0.94, 0.90),
                new GateThresholds(0.80, 0.80));

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(List.of("not_better_than_champion"), decision.reasonCodes());
    }

    @Test
    void shouldPromoteFirstCandidateThatPassesGates() {
        PromotionDecision decision = policy.decide(metrics(0.91, 0.90), null, new GateThresholds(0.90, 0.90));

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
    }

    @Test
    void shouldPromoteOnExactTieWithChampion() {
        PromotionDecision decision = policy.decide(
                metrics(0.92, 0.90),
                metrics(0.92, 0.90),
                new GateThresholds(0.90, 0.90));

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
    }

    @Test
    void shouldRejectWhenOnlyF1DropsBelowChampion() {
        PromotionDecision decision = policy.decide(
                metrics(0.99, 0.89),
                metrics(0.90, 0.90),
                new GateThresholds(0.50, 0.50));

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(Set.of(ReasonCode.NOT_BETTER_THAN_CHAMPION), decision.reasons());
    }

    @Test
    void shouldReportBothReasonsWhenGatesFailAndChampionIsBetter() {
        PromotionDecision decision = policy.decide(
                metrics(0.70, 0.60),
                metrics(0.95, 0.95),
                new GateThresholds(0.90, 0.90));

        assertEquals(PromotionOutcome.REJECT, decision.outcome());
        assertEquals(List.of("failed_gates", "not_better_than_champion"), decision.reasonCodes());
    }

    @Test
    void shouldNeverPromoteWhenGatesFailEvenIfBetterThanChampion() {
        double[][] grid = { { 0.50, 0.95 }, { 0.95, 0.50 }, { 0.89, 0.89 } };
        for (double[] candidate : grid) {
            for (Metrics champion : new Metrics[] { null, metrics(0.10, 0.10), metrics(0.99, 0.99) }) {
                PromotionDecision decision = policy.decide(
                        metrics(candidate[0], candidate[1]),
                        champion,
                        new GateThresholds(0.90, 0.90));
                assertEquals(PromotionOutcome.REJECT, decision.outcome());
                assertTrue(decision.reasons().contains(ReasonCode.FAILED_GATES));
            }
        }
    }

    @Test
    void shouldIgnoreChampionGapWhenGatesAreZero() {
        PromotionDecision decision = policy.decide(metrics(0.0, 0.0), null, GateThresholds.none());

        assertEquals(PromotionOutcome.PROMOTE, decision.outcome());
    }

    private static Metrics metrics(double accuracy, double f1) {
        return new Metrics(accuracy, f1, f1, f1, null);
    }
}
