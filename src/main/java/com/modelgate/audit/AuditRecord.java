package com.modelgate.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.modelgate.promotion.PromotionOutcome;

/**
 * One promotion run as written to the audit trail. {@code championVersion} and {@code championMetrics} are null
 * when no champion existed; the metric maps are empty when the run was skipped before scoring.
 */
public record AuditRecord(
        Instant timestamp,
        String modelName,
        long candidateVersion,
        Long championVersion,
        PromotionOutcome decision,
        List<String> reasons,
        Map<String, Double> candidateMetrics,
        Map<String, Double> championMetrics) {
    public AuditRecord {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        candidateMetrics = candidateMetrics == null ? Map.of() : Map.copyOf(candidateMetrics);
        championMetrics = championMetrics == null ? null : Map.copyOf(championMetrics);
    }
}
