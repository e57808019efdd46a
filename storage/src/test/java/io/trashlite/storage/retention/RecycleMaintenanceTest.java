package io.trashlite.storage.retention;

import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;
import io.trashlite.core.ErrorKind;
import io.trashlite.core.ItemStatus;
import io.trashlite.core.MaintenanceStatus;
import io.trashlite.storage.BatchReconstructor;
import io.trashlite.storage.FilesPathMover;
import io.trashlite.storage.JsonlAuditLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecycleMaintenanceTest {

    private static final long DAY = 24L * 3600 * 1000;
    private static final long NOW = 20_000 * DAY;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

    @TempDir Path tmp;

    private Path recycleRoot;
    private JsonlAuditLog log;
    private RecycleMaintenance maintenance;

    @BeforeEach
    void setUp() throws IOException {
        recycleRoot = Files.createDirectories(tmp.resolve("recycle-bin"));
        log = new JsonlAuditLog(tmp.resolve("index.jsonl"));
        maintenance = new RecycleMaintenance(log, new BatchReconstructor(log, CLOCK), recycleRoot,
                new FilesPathMover(), CLOCK);
    }

    private Path createBatch(String batchId, long ageDays, long sizeBytes) throws IOException {
        Path item = Files.createDirectories(recycleRoot.resolve(batchId).resolve("0001_item"));
        Files.writeString(item.resolve("payload.bin"), "p");
        cleanupRow(batchId, item, ageDays, sizeBytes);
        return recycleRoot.resolve(batchId);
    }

    private void cleanupRow(String batchId, Path recyclePath, long ageDays, long sizeBytes) {
        log.append(AuditRecord.builder(AuditAction.CLEANUP)
                .time(NOW - ageDays * DAY)
                .scope("cleanup_monthly")
                .batchId(batchId)
                .sourcePath("/source/" + batchId)
                .recyclePath(recyclePath.toString())
                .status(ItemStatus.SUCCESS)
                .sizeBytes(sizeBytes)
                .build());
    }

    private List<AuditRecord> maintainRecords() {
        return log.readAll().stream().filter(r -> r.action() == AuditAction.RECYCLE_MAINTAIN).toList();
    }

    private static long num(AuditRecord r, String key) {
        return ((Number) r.metadata().get(key)).longValue();
    }

    @Test
    void deletes_old_batches_and_keeps_recent_ones() throws Exception {
        Path old1 = createBatch("old-1", 60, 10);
        Path old2 = createBatch("old-2", 45, 20);
        Path recent = createBatch("recent", 2, 5);

        MaintenanceSummary s = maintenance.maintain(new RetentionPolicy(true, 30, 1, 20), false, null);

        assertEquals(MaintenanceStatus.SUCCESS, s.status());
        assertEquals(2, s.deletedBatches());
        assertEquals(30L, s.deletedBytes());
        assertEquals(2, s.selectedByAge());
        assertFalse(Files.exists(old1));
        assertFalse(Files.exists(old2));
        assertTrue(Files.exists(recent));
        assertEquals(1, s.after().totalBatches());

        List<AuditRecord> rows = maintainRecords();
        assertEquals(1, rows.size());
        AuditRecord rec = rows.get(0);
        assertEquals("success", rec.status());
        assertEquals(recycleRoot.toString(), rec.metadata().get("recycle_root"));
        assertEquals(3, num(rec, "before_batches"));
        assertEquals(2, num(rec, "deleted_batches"));
        assertEquals(0, num(rec, "failed_batches"));
        assertEquals(1, num(rec, "remaining_batches"));
        assertNull(rec.metadata().get("error_type"));
        assertEquals(Map.of("enabled", true, "maxAgeDays", 30, "minKeepBatches", 1, "sizeThresholdGB", 20),
                rec.metadata().get("policy"));
    }

    @Test
    void dry_run_deletes_nothing_and_reports_what_would_go() throws Exception {
        Path old = createBatch("old", 90, 10);
        createBatch("recent", 1, 5);

        MaintenanceSummary s = maintenance.maintain(new RetentionPolicy(true, 30, 1, 20), true, null);

        assertEquals(MaintenanceStatus.DRY_RUN, s.status());
        assertEquals(1, s.deletedBatches());
        assertTrue(Files.exists(old));
        AuditRecord rec = maintainRecords().get(0);
        assertTrue(rec.dryRun());
        assertEquals(2, num(rec, "remaining_batches"));
    }

    @Test
    void disabled_policy_and_empty_selection_still_write_one_record() throws Exception {
        createBatch("young", 1, 1);

        MaintenanceSummary disabled = maintenance.maintain(new RetentionPolicy(false, 30, 1, 20), false, null);
        MaintenanceSummary none = maintenance.maintain(new RetentionPolicy(true, 30, 1, 20), false, null);

        assertEquals(MaintenanceStatus.SKIPPED_DISABLED, disabled.status());
        assertEquals(MaintenanceStatus.SKIPPED_NO_CANDIDATE, none.status());
        List<AuditRecord> rows = maintainRecords();
        assertEquals(2, rows.size());
        assertEquals("skipped_disabled", rows.get(0).status());
        assertEquals("skipped_no_candidate", rows.get(1).status());
        assertTrue(Files.exists(recycleRoot.resolve("young")));
    }

    @Test
    void batch_with_entries_outside_its_directory_is_refused_others_still_go() throws Exception {
        Path itemA = Files.createDirectories(recycleRoot.resolve("batch-A/0001_item"));
        Path itemB = Files.createDirectories(recycleRoot.resolve("batch-B/0002_item"));
        Files.writeString(itemA.resolve("payload.bin"), "a");
        Files.writeString(itemB.resolve("payload.bin"), "b");
        cleanupRow("mixed-batch", itemA, 90, 1);
        cleanupRow("mixed-batch", itemB, 90, 1);
        Path safe = createBatch("safe-batch", 80, 1);
        Path fresh = createBatch("fresh-batch", 1, 1);
        Path unrelated = Files.createDirectories(tmp.resolve("unrelated"));

        for (boolean dry : new boolean[]{true, false}) {
            MaintenanceSummary s = maintenance.maintain(new RetentionPolicy(true, 30, 1, 20), dry, null);
            assertEquals(MaintenanceStatus.PARTIAL_FAILED, s.status(), "dryRun=" + dry);
            assertEquals(1, s.failedBatches());
            assertEquals(1, s.deletedBatches());

            BatchFailure f = s.failures().get(0);
            assertEquals("mixed-batch", f.batchId());
            assertEquals(BatchFailure.INCONSISTENT_BATCH_ROOTS, f.invalidReason());
            assertEquals(ErrorKind.PATH_VALIDATION_FAILED, f.kind());
        }

        assertTrue(Files.exists(itemA));
        assertTrue(Files.exists(itemB));
        assertTrue(Files.exists(unrelated));
        assertFalse(Files.exists(safe));
        assertTrue(Files.exists(fresh));

        List<AuditRecord> rows = maintainRecords();
        assertEquals(2, rows.size());
        assertEquals("partial_failed", rows.get(1).status());
        assertEquals("path_validation_failed", rows.get(1).metadata().get("error_type"));
    }

    @Test
    void batch_id_escaping_the_recycle_root_is_refused() throws Exception {
        Path evil = Files.createDirectories(tmp.resolve("evil"));
        Path item = Files.createDirectories(evil.resolve("0001_item"));
        cleanupRow("../evil", item, 90, 1);
        createBatch("recent", 1, 1);

        MaintenanceSummary s = maintenance.maintain(new RetentionPolicy(true, 30, 1, 20), false, null);

        assertEquals(MaintenanceStatus.PARTIAL_FAILED, s.status());
        assertEquals(BatchFailure.BATCH_OUTSIDE_RECYCLE_ROOT, s.failures().get(0).invalidReason());
        assertTrue(Files.exists(item));
    }

    @Test
    void stats_report_disk_and_indexed_bytes() throws Exception {
        createBatch("a", 10, 100);
        createBatch("b", 5, 50);
        Files.writeString(recycleRoot.resolve("orphan.bin"), "orphan");

        RecycleStats stats = maintenance.collectStats();

        assertEquals(2, stats.totalBatches());
        assertEquals(150L, stats.indexedBytes());
        assertEquals(2L + "orphan".length(), stats.totalBytes());
        assertEquals(NOW - 10 * DAY, stats.oldestTime());
    }

    @Test
    void empty_bin_has_no_oldest_time() {
        RecycleStats stats = maintenance.collectStats();
        assertEquals(0, stats.totalBatches());
        assertEquals(0L, stats.indexedBytes());
        assertNull(stats.oldestTime());
    }
}
