package com.modelgate.audit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelgate.promotion.PromotionOutcome;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlAuditRecorderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendOneLinePerRecordAndFilterByOutcome() throws Exception {
        Path log = tempDir.resolve("audit/promotion-audit.jsonl");
        JsonlAuditRecorder recorder = new JsonlAuditRecorder(log);

        recorder.record(new AuditRecord(Instant.parse("2026-01-01T00:00:00Z"), "iris", 1L, null,
                PromotionOutcome.PROMOTE, List.of(), Map.of("accuracy", 0.95), null));
        recorder.record(new AuditRecord(Instant.parse("2026-01-02T00:00:00Z"), "iris", 2L, 1L,
                PromotionOutcome.REJECT, List.of("failed_gates"), Map.of("accuracy", 0.5), Map.of("accuracy", 0.95)));
        recorder.record(new AuditRecord(Instant.parse("2026-01-03T00:00:00Z"), "other", 1L, null,
                PromotionOutcome.PROMOTE, List.of(), Map.of("accuracy", 0.9), null));

        assertEquals(3, Files.readAllLines(log).size());
        assertEquals(2, recorder.find("iris", null).size());

        List<AuditRecord> rejected = recorder.find("iris", PromotionOutcome.REJECT);
        assertEquals(1, rejected.size());
        AuditRecord record = rejected.get(0);
        assertEquals(2L, record.candidateVersion());
        assertEquals(1L, record.championVersion());
        assertEquals(List.of("failed_gates"), record.reasons());
        assertEquals(0.95, record.championMetrics().get("accuracy"));
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), record.timestamp());
    }

    @Test
    void shouldKeepAbsentChampionAsNull() {
        JsonlAuditRecorder recorder = new JsonlAuditRecorder(tempDir.resolve("audit.jsonl"));
        recorder.record(new AuditRecord(Instant.now(), "iris", 1L, null, PromotionOutcome.SKIP, null, null, null));

        AuditRecord record = recorder.readAll().get(0);
        assertNull(record.championVersion());
        assertNull(record.championMetrics());
        assertTrue(record.candidateMetrics().isEmpty());
    }

    @Test
    void shouldReturnNothingBeforeFirstRecord() {
        assertTrue(new JsonlAuditRecorder(tempDir.resolve("none.jsonl")).find("iris", null).isEmpty());
    }

    @Test
    void shouldFailWhenLogIsUnwritable() throws Exception {
        Path directoryInTheWay = Files.createDirectories(tempDir.resolve("audit.jsonl"));

        assertThrows(AuditException.class, () -> new JsonlAuditRecorder(directoryInTheWay).record(
                new AuditRecord(Instant.now(), "iris", 1L, null, PromotionOutcome.SKIP, null, null, null)));
    }
}
