package com.modelgate.promotion;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.modelgate.evaluation.Metrics;

/**
 * Gate-and-compare rule for a candidate.
 *
 * <p>The candidate must meet both gates. When a champion exists the candidate must also be at least as good on
 * accuracy and on macro F1; equal metrics count as good enough, so a retrained model with flat performance still
 * replaces the champion.
 */
public class PromotionPolicy {

    /**
     * @param championMetrics metrics of the current champion, or {@code null} before the first promotion
     */
    public PromotionDecision decide(Metrics candidateMetrics, Metrics championMetrics, GateThresholds thresholds) {
        Objects.requireNonNull(candidateMetrics, "candidateMetrics");
        Objects.requireNonNull(thresholds, "thresholds");

        boolean gatesOk = candidateMetrics.accuracy() >= thresholds.minAccuracy()
                && candidateMetrics.f1Macro() >= thresholds.minF1();

        boolean betterOrEqual = championMetrics == null
                || (candidateMetrics.accuracy() >= championMetrics.accuracy()
                        && candidateMetrics.f1Macro() >= championMetrics.f1Macro());

        if (gatesOk && betterOrEqual) {
            return PromotionDecision.promote();
        }

        Set<ReasonCode> reasons = EnumSet.noneOf(ReasonCode.class);
        if (!gatesOk) {
            reasons.add(ReasonCode.FAILED_GATES);
        }
        if (!betterOrEqual) {
            reasons.add(ReasonCode.NOT_BETTER_THAN_CHAMPION);
        }
        return PromotionDecision.reject(reasons);
    }
}
