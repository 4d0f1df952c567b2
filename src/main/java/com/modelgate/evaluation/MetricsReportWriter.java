package com.modelgate.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes the flat metrics report consumed by downstream pipeline tooling.
 */
public class MetricsReportWriter {
    private final ObjectMapper objectMapper;

    public MetricsReportWriter() {
        this(new ObjectMapper());
    }

    MetricsReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(Path reportPath, Metrics metrics) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), metrics.asMap());
        return reportPath;
    }
}
