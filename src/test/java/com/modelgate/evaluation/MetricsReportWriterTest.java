package com.modelgate.evaluation;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteFlatReportWithoutMissingAuc() throws Exception {
        Path report = new MetricsReportWriter().write(
                tempDir.resolve("reports/metrics.json"),
                new Metrics(0.9, 0.8, 0.7, 0.75, null));

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals(0.9, json.get("accuracy").asDouble());
        assertEquals(0.8, json.get("precision_macro").asDouble());
        assertEquals(0.7, json.get("recall_macro").asDouble());
        assertEquals(0.75, json.get("f1_macro").asDouble());
        assertFalse(json.has("roc_auc_macro"));
    }

    @Test
    void shouldIncludeAucWhenPresent() throws Exception {
        Path report = new MetricsReportWriter().write(
                tempDir.resolve("metrics.json"),
                new Metrics(0.9, 0.8, 0.7, 0.75, 0.97));

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertTrue(json.has("roc_auc_macro"));
        assertEquals(0.97, json.get("roc_auc_macro").asDouble());
    }
}
