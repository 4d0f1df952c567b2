package com.modelgate.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelgate.promotion.PromotionOutcome;
import com.modelgate.registry.MlflowRestClient;
import com.modelgate.registry.MlflowTrackingClient;

/**
 * Writes each audit record as a finished MLflow tracking run: identifying values as run tags, metrics prefixed
 * with {@code candidate_} and {@code champion_}.
 */
public class MlflowAuditRecorder implements AuditRecorder {
    private static final Logger log = LoggerFactory.getLogger(MlflowAuditRecorder.class);
    static final String RUN_NAME = "validation_compare_champion_challenger";
    static final String CANDIDATE_PREFIX = "candidate_";
    static final String CHAMPION_PREFIX = "champion_";
    static final String NO_CHAMPION = "None";

    private final MlflowTrackingClient tracking;
    private final String experimentName;
    private final Clock clock;

    public MlflowAuditRecorder(MlflowRestClient rest, String experimentName) {
        this(rest, experimentName, Clock.systemUTC());
    }

    MlflowAuditRecorder(MlflowRestClient rest, String experimentName, Clock clock) {
        this.tracking = new MlflowTrackingClient(rest);
        this.experimentName = experimentName;
        this.clock = clock;
    }

    @Override
    public void record(AuditRecord record) {
        String experimentId = tracking.ensureExperiment(experimentName);

        Map<String, Double> metrics = new LinkedHashMap<>();
        record.candidateMetrics().forEach((key, value) -> metrics.put(CANDIDATE_PREFIX + key, value));
        if (record.championMetrics() != null) {
            record.championMetrics().forEach((key, value) -> metrics.put(CHAMPION_PREFIX + key, value));
        }
        String runId = tracking.logFinishedRun(
                experimentId,
                RUN_NAME,
                record.timestamp().toEpochMilli(),
                clock.millis(),
                tagsOf(record),
                metrics);
        log.info("audit.recorded backend=mlflow experiment={} runId={} decision={}",
                experimentName, runId, record.decision().code());
    }

    @Override
    public List<AuditRecord> find(String modelName, PromotionOutcome outcome) {
        String experimentId = tracking.ensureExperiment(experimentName);
        String filter = "tags.model_name = '" + modelName + "'";
        if (outcome != null) {
            filter += " and tags.decision = '" + outcome.code() + "'";
        }
        List<AuditRecord> records = new ArrayList<>();
        for (JsonNode run : tracking.searchRuns(experimentId, filter, 1000)) {
            records.add(parseRun(run));
        }
        return records;
    }

    private Map<String, String> tagsOf(AuditRecord record) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("model_name", record.modelName());
        tags.put("candidate_version", Long.toString(record.candidateVersion()));
        tags.put("champion_version", record.championVersion() == null ? NO_CHAMPION : record.championVersion().toString());
        tags.put("decision", record.decision().code());
        tags.put("reasons", String.join(",", record.reasons()));
        return tags;
    }

    private AuditRecord parseRun(JsonNode run) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (JsonNode tag : run.path("data").path("tags")) {
            tags.put(tag.path("key").asText(), tag.path("value").asText());
        }
        Map<String, Double> candidate = new LinkedHashMap<>();
        Map<String, Double> champion = new LinkedHashMap<>();
        for (JsonNode metric : run.path("data").path("metrics")) {
            String key = metric.path("key").asText();
            if (key.startsWith(CANDIDATE_PREFIX)) {
                candidate.put(key.substring(CANDIDATE_PREFIX.length()), metric.path("value").asDouble());
            } else if (key.startsWith(CHAMPION_PREFIX)) {
                champion.put(key.substring(CHAMPION_PREFIX.length()), metric.path("value").asDouble());
            }
        }
        String championVersion = tags.getOrDefault("champion_version", NO_CHAMPION);
        String reasons = tags.getOrDefault("reasons", "");
        return new AuditRecord(
                Instant.ofEpochMilli(run.path("info").path("start_time").asLong()),
                tags.get("model_name"),
                Long.parseLong(tags.getOrDefault("candidate_version", "0")),
                NO_CHAMPION.equals(championVersion) ? null : Long.valueOf(championVersion),
                PromotionOutcome.fromCode(tags.getOrDefault("decision", PromotionOutcome.SKIP.code())),
                reasons.isBlank() ? List.of() : Arrays.asList(reasons.split(",")),
                candidate,
                champion.isEmpty() ? null : champion);
    }
}
