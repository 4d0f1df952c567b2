package com.modelgate.audit;

import java.util.List;

import com.modelgate.promotion.PromotionOutcome;

public interface AuditRecorder {
    /**
     * Persists the record synchronously. Failure aborts the run before any registry mutation.
     */
    void record(AuditRecord record);

    /**
     * Records for the model, optionally restricted to one outcome ({@code null} for all).
     */
    List<AuditRecord> find(String modelName, PromotionOutcome outcome);
}
