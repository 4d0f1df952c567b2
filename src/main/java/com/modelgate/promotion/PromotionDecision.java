package com.modelgate.promotion;

import java.util.List;
import java.util.Set;

public record PromotionDecision(PromotionOutcome outcome, Set<ReasonCode> reasons) {
    public PromotionDecision {
        reasons = reasons == null || reasons.isEmpty() ? Set.of() : Set.copyOf(reasons);
    }

    public static PromotionDecision promote() {
        return new PromotionDecision(PromotionOutcome.PROMOTE, Set.of());
    }

    public static PromotionDecision reject(Set<ReasonCode> reasons) {
        return new PromotionDecision(PromotionOutcome.REJECT, reasons);
    }

    public static PromotionDecision skip() {
        return new PromotionDecision(PromotionOutcome.SKIP, Set.of());
    }

    /**
     * Reason codes in declaration order, e.g. {@code [failed_gates, not_better_than_champion]}.
     */
    public List<String> reasonCodes() {
        return reasons.stream().sorted().map(ReasonCode::code).toList();
    }
}
