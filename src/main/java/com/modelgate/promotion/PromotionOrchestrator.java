package com.modelgate.promotion;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.audit.AuditRecord;
import com.modelgate.audit.AuditRecorder;
import com.modelgate.evaluation.HoldoutDataset;
import com.modelgate.evaluation.Metrics;
import com.modelgate.evaluation.MetricsEvaluator;
import com.modelgate.evaluation.Predictor;
import com.modelgate.registry.ModelVersion;
import com.modelgate.registry.RegistryClient;

/**
 * Runs one validate-and-promote cycle for a model name.
 *
 * <p>Side effects happen in a fixed order: the audit record is written first, then the production pointer is
 * moved, then tags are attached, then the serving layer is notified. A failure at any later step leaves the
 * earlier ones in place. A candidate that already holds the production pointer is skipped without scoring and
 * without any registry mutation, but still audited.
 */
public class PromotionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PromotionOrchestrator.class);

    static final String TAG_DECISION = "decision";
    static final String TAG_REJECTED_REASON = "rejected_reason";
    static final String DECISION_PROMOTED = "promoted";
    static final String DECISION_REJECTED = "rejected";

    private final RegistryClient registry;
    private final MetricsEvaluator evaluator;
    private final PromotionPolicy policy;
    private final AuditRecorder auditRecorder;
    private final ReloadNotifier reloadNotifier;
    private final Clock clock;

    public PromotionOrchestrator(RegistryClient registry, AuditRecorder auditRecorder, ReloadNotifier reloadNotifier) {
        this(registry, new MetricsEvaluator(), new PromotionPolicy(), auditRecorder, reloadNotifier, Clock.systemUTC());
    }

    PromotionOrchestrator(
            RegistryClient registry,
            MetricsEvaluator evaluator,
            PromotionPolicy policy,
            AuditRecorder auditRecorder,
            ReloadNotifier reloadNotifier,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.auditRecorder = Objects.requireNonNull(auditRecorder, "auditRecorder");
        this.reloadNotifier = reloadNotifier == null ? ReloadNotifier.disabled() : reloadNotifier;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PromotionResult run(String modelName, HoldoutDataset holdout, GateThresholds thresholds) {
        Objects.requireNonNull(modelName, "modelName");
        Objects.requireNonNull(thresholds, "thresholds");

        ModelVersion candidate = resolveCandidate(modelName);
        ModelVersion champion = registry.resolveChampion(modelName).orElse(null);
        log.info("promotion.resolved model={} candidate={} stage={} champion={}",
                modelName, candidate.version(), candidate.stage(), champion == null ? "none" : champion.version());

        if (champion != null && champion.version() == candidate.version()) {
            PromotionDecision skip = PromotionDecision.skip();
            audit(modelName, candidate, champion, skip, null, null);
            log.info("promotion.skipped model={} version={} reason=already-champion", modelName, candidate.version());
            return new PromotionResult(skip, candidate, champion, null, null, false);
        }

        Predictor candidatePredictor = registry.loadPredictor(candidate);
        Predictor championPredictor = champion == null ? null : registry.loadPredictor(champion);

        Metrics candidateMetrics = evaluator.score(candidatePredictor, holdout);
        Metrics championMetrics = championPredictor == null ? null : evaluator.score(championPredictor, holdout);
        log.info("promotion.scored model={} version={} role=candidate metrics={}",
                modelName, candidate.version(), candidateMetrics.asMap());
        if (championMetrics != null) {
            log.info("promotion.scored model={} version={} role=champion metrics={}",
                    modelName, champion.version(), championMetrics.asMap());
        }

        PromotionDecision decision = policy.decide(candidateMetrics, championMetrics, thresholds);
        log.info("promotion.decided model={} candidate={} outcome={} reasons={} minAccuracy={} minF1={}",
                modelName, candidate.version(), decision.outcome().code(), decision.reasonCodes(),
                thresholds.minAccuracy(), thresholds.minF1());

        audit(modelName, candidate, champion, decision, candidateMetrics, championMetrics);

        boolean notified = false;
        if (decision.outcome() == PromotionOutcome.PROMOTE) {
            registry.promote(modelName, candidate.version());
            verifyProductionPointer(modelName, candidate);
            tagQuietly(modelName, candidate.version(), TAG_DECISION, DECISION_PROMOTED);
            log.info("promotion.promoted model={} version={} previous={}",
                    modelName, candidate.version(), champion == null ? "none" : champion.version());
            notified = notifyReload(candidate);
        } else {
            tagQuietly(modelName, candidate.version(), TAG_DECISION, DECISION_REJECTED);
            tagQuietly(modelName, candidate.version(), TAG_REJECTED_REASON, String.join(",", decision.reasonCodes()));
            log.info("promotion.rejected model={} version={} reasons={}; production pointer unchanged",
                    modelName, candidate.version(), decision.reasonCodes());
        }
        return new PromotionResult(decision, candidate, champion, candidateMetrics, championMetrics, notified);
    }

    private ModelVersion resolveCandidate(String modelName) {
        List<ModelVersion> versions = registry.listVersions(modelName);
        return versions.stream()
                .max(Comparator.comparingLong(ModelVersion::version))
                .orElseThrow(() -> new NoVersionsException(modelName));
    }

    private void audit(
            String modelName,
            ModelVersion candidate,
            ModelVersion champion,
            PromotionDecision decision,
            Metrics candidateMetrics,
            Metrics championMetrics) {
        auditRecorder.record(new AuditRecord(
                clock.instant(),
                modelName,
                candidate.version(),
                champion == null ? null : champion.version(),
                decision.outcome(),
                decision.reasonCodes(),
                candidateMetrics == null ? null : candidateMetrics.asMap(),
                championMetrics == null ? null : championMetrics.asMap()));
    }

    private void verifyProductionPointer(String modelName, ModelVersion candidate) {
        Optional<ModelVersion> current = registry.resolveChampion(modelName);
        if (current.isEmpty() || current.get().version() != candidate.version()) {
            throw new RegistryConsistencyException("Promoted " + candidate.label() + " but registry reports production="
                    + current.map(version -> Long.toString(version.version())).orElse("none"));
        }
    }

    private void tagQuietly(String modelName, long version, String key, String value) {
        try {
            registry.tag(modelName, version, key, value);
        } catch (RuntimeException e) {
            log.warn("promotion.tag.failed model={} version={} key={} reason={}", modelName, version, key, e.getMessage(), e);
        }
    }

    private boolean notifyReload(ModelVersion promoted) {
        if (!reloadNotifier.isEnabled()) {
            return false;
        }
        try {
            reloadNotifier.notifyReload(promoted);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("reload.failed model={} version={} reason={}", promoted.name(), promoted.version(), e.getMessage(), e);
            return false;
        }
    }
}
