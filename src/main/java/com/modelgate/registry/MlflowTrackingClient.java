package com.modelgate.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Experiment and run calls of the MLflow tracking API. Runs are written complete: created with their tags,
 * given their metrics in one batch, then marked {@code FINISHED}.
 */
public class MlflowTrackingClient {
    private static final Logger log = LoggerFactory.getLogger(MlflowTrackingClient.class);
    private static final String API = "api/2.0/mlflow/";

    private final MlflowRestClient rest;

    public MlflowTrackingClient(MlflowRestClient rest) {
        this.rest = rest;
    }

    /**
     * Id of the named experiment, created on first use.
     */
    public String ensureExperiment(String experimentName) {
        return rest.getIfExists(API + "experiments/get-by-name", Map.of("experiment_name", experimentName))
                .map(response -> response.path("experiment").path("experiment_id").asText())
                .orElseGet(() -> {
                    log.info("tracking.experiment.create name={}", experimentName);
                    return rest.post(API + "experiments/create", Map.of("name", experimentName))
                            .path("experiment_id").asText();
                });
    }

    /**
     * Writes one finished run and returns its id.
     */
    public String logFinishedRun(
            String experimentId,
            String runName,
            long startMillis,
            long endMillis,
            Map<String, String> tags,
            Map<String, Double> metrics) {
        Map<String, Object> createRun = new LinkedHashMap<>();
        createRun.put("experiment_id", experimentId);
        createRun.put("run_name", runName);
        createRun.put("start_time", startMillis);
        createRun.put("tags", keyValues(tags));
        String runId = rest.post(API + "runs/create", createRun).path("run").path("info").path("run_id").asText();

        if (!metrics.isEmpty()) {
            List<Map<String, Object>> batch = new ArrayList<>();
            metrics.forEach((key, value) -> batch.add(Map.of(
                    "key", key,
                    "value", value,
                    "timestamp", startMillis,
                    "step", 0)));
            rest.post(API + "runs/log-batch", Map.of("run_id", runId, "metrics", batch));
        }

        rest.post(API + "runs/update", Map.of(
                "run_id", runId,
                "status", "FINISHED",
                "end_time", endMillis));
        log.debug("tracking.run.logged experimentId={} runName={} runId={} metrics={}",
                experimentId, runName, runId, metrics.size());
        return runId;
    }

    /**
     * Runs of one experiment matching an MLflow search filter, newest first.
     */
    public JsonNode searchRuns(String experimentId, String filter, int maxResults) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("experiment_ids", List.of(experimentId));
        body.put("filter", filter);
        body.put("max_results", maxResults);
        body.put("order_by", List.of("attributes.start_time DESC"));
        return rest.post(API + "runs/search", body).path("runs");
    }

    private List<Map<String, String>> keyValues(Map<String, String> values) {
        List<Map<String, String>> out = new ArrayList<>();
        values.forEach((key, value) -> out.add(Map.of("key", key, "value", value)));
        return out;
    }
}
