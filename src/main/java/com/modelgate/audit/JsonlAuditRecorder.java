package com.modelgate.audit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.modelgate.promotion.PromotionOutcome;

/**
 * Append-only audit trail with one JSON document per line.
 */
public class JsonlAuditRecorder implements AuditRecorder {
    private final Path auditLogPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public JsonlAuditRecorder(Path auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    @Override
    public void record(AuditRecord record) {
        try {
            Path parent = auditLogPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = mapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new AuditException("Unable to append audit record to " + auditLogPath, e);
        }
    }

    @Override
    public List<AuditRecord> find(String modelName, PromotionOutcome outcome) {
        return readAll().stream()
                .filter(record -> record.modelName().equals(modelName))
                .filter(record -> outcome == null || record.decision() == outcome)
                .toList();
    }

    public List<AuditRecord> readAll() {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        try {
            List<AuditRecord> records = new ArrayList<>();
            for (String line : Files.readAllLines(auditLogPath)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                records.add(mapper.readValue(line, AuditRecord.class));
            }
            return records;
        } catch (IOException e) {
            throw new AuditException("Unable to read audit log " + auditLogPath, e);
        }
    }
}
