package com.modelgate.promotion;

import com.modelgate.evaluation.Metrics;
import com.modelgate.registry.ModelVersion;

/**
 * Outcome of one orchestration run. Metrics are null when the run was skipped; champion fields are null when
 * there was no champion.
 */
public record PromotionResult(
        PromotionDecision decision,
        ModelVersion candidate,
        ModelVersion champion,
        Metrics candidateMetrics,
        Metrics championMetrics,
        boolean reloadNotified) {

    public PromotionOutcome outcome() {
        return decision.outcome();
    }
}
