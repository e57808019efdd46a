// file: src/main/java/io/trashlite/storage/retention/RecycleMaintenance.java
package io.trashlite.storage.retention;

import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;
import io.trashlite.core.Batch;
import io.trashlite.core.ErrorClassifier;
import io.trashlite.core.ErrorKind;
import io.trashlite.core.MaintenanceStatus;
import io.trashlite.core.PathSafety;
import io.trashlite.storage.AuditLog;
import io.trashlite.storage.BatchReconstructor;
import io.trashlite.storage.DiskUsage;
import io.trashlite.storage.PathMover;
import io.trashlite.storage.ProgressListener;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a {@link RetentionPolicy} to the recycle bin, permanently deleting whole batches.
 * <p>
 * maintain():
 *  1) stats before (restorable batches from the log, on-disk bytes of the recycle root);
 *  2) disabled policy         -> record skipped_disabled;
 *  3) nothing selected        -> record skipped_no_candidate;
 *  4) per candidate, newest-first:
 *      - batch directory must be a child of the recycle root, and every entry's
 *        recyclePath must sit under that directory; otherwise the batch fails with
 *        inconsistent_batch_roots and nothing is deleted for it;
 *      - dry run counts it as deleted;
 *      - live run deletes {@code <recycleRoot>/<batchId>} recursively.
 *  5) exactly one recycle_maintain record summarizing the run.
 * <p>
 * The consistency check runs in dry-run as well so a preview reports the same failures a
 * live run would hit.
 */
public final class RecycleMaintenance {
    private static final Logger log = Logger.getLogger(RecycleMaintenance.class.getName());

    private final AuditLog auditLog;
    private final BatchReconstructor reconstructor;
    private final Path recycleRoot;
    private final PathMover mover;
    private final Clock clock;

    public RecycleMaintenance(AuditLog auditLog, BatchReconstructor reconstructor, Path recycleRoot,
                              PathMover mover, Clock clock) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.reconstructor = Objects.requireNonNull(reconstructor, "reconstructor");
        this.recycleRoot = Objects.requireNonNull(recycleRoot, "recycleRoot").toAbsolutePath().normalize();
        this.mover = Objects.requireNonNull(mover, "mover");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RecycleStats collectStats() {
        List<Batch> batches = reconstructor.listRestorableBatches();
        long indexed = 0;
        Long oldest = null;
        for (Batch b : batches) {
            indexed += b.totalBytes();
            oldest = oldest == null ? b.firstTime() : Math.min(oldest, b.firstTime());
        }
        return new RecycleStats(batches, DiskUsage.sizeOf(recycleRoot), indexed, oldest);
    }

    public MaintenanceSummary maintain(RetentionPolicy policy, boolean dryRun, ProgressListener progress) {
        RetentionPolicy p = Objects.requireNonNull(policy, "policy").normalize();
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        long now = clock.millis();

        RecycleStats before = collectStats();
        RetentionSelection selection = RetentionSelector.select(before.batches(), p, now);
        boolean overThreshold = before.totalBytes() > selection.thresholdBytes();

        log.info(() -> String.format("Recycle maintenance started: %d batch(es), %d bytes on disk, %d candidate(s), dryRun=%s",
                before.totalBatches(), before.totalBytes(), selection.candidates().size(), dryRun));

        if (!p.enabled() || selection.candidates().isEmpty()) {
            MaintenanceStatus status = p.enabled() ? MaintenanceStatus.SKIPPED_NO_CANDIDATE : MaintenanceStatus.SKIPPED_DISABLED;
            MaintenanceSummary summary = new MaintenanceSummary(status, dryRun, p, before, before,
                    selection.thresholdBytes(), overThreshold, selection.candidates().size(),
                    selection.selectedByAge(), selection.selectedBySize(), 0, 0L, List.of());
            appendRecord(summary, now);
            log.info(() -> "Recycle maintenance skipped: " + status.wire());
            return summary;
        }

        List<SelectedBatch> candidates = selection.candidates();
        int deleted = 0;
        long deletedBytes = 0;
        List<BatchFailure> failures = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            listener.onProgress(i + 1, candidates.size());
            Batch batch = candidates.get(i).batch();

            Path batchRoot = batchRoot(batch.batchId());
            if (batchRoot == null) {
                failures.add(refuse(batch, BatchFailure.BATCH_OUTSIDE_RECYCLE_ROOT,
                        "Batch directory escapes the recycle root"));
                continue;
            }
            if (!entriesUnder(batch, batchRoot)) {
                failures.add(refuse(batch, BatchFailure.INCONSISTENT_BATCH_ROOTS,
                        "Batch entries point outside " + batchRoot));
                continue;
            }

            if (dryRun) {
                deleted++;
                deletedBytes += batch.totalBytes();
                continue;
            }

            try {
                mover.deleteRecursively(batchRoot);
                deleted++;
                deletedBytes += batch.totalBytes();
            } catch (IOException | RuntimeException e) {
                String message = ErrorClassifier.describe(e);
                ErrorKind kind = ErrorClassifier.classify(e);
                log.log(Level.WARNING, "Failed to delete batch " + batchRoot + " (" + kind.wire() + ")", e);
                failures.add(new BatchFailure(batch.batchId(), message, kind, null));
            }
        }

        RecycleStats after = dryRun ? before : collectStats();
        MaintenanceStatus status = !failures.isEmpty()
                ? MaintenanceStatus.PARTIAL_FAILED
                : dryRun ? MaintenanceStatus.DRY_RUN : MaintenanceStatus.SUCCESS;

        MaintenanceSummary summary = new MaintenanceSummary(status, dryRun, p, before, after,
                selection.thresholdBytes(), overThreshold, candidates.size(),
                selection.selectedByAge(), selection.selectedBySize(), deleted, deletedBytes, failures);
        appendRecord(summary, clock.millis());

        log.info(() -> String.format("Recycle maintenance finished: status=%s deleted=%d bytes=%d failed=%d",
                summary.status().wire(), summary.deletedBatches(), summary.deletedBytes(), summary.failedBatches()));
        return summary;
    }

    public Path recycleRoot() {
        return recycleRoot;
    }

    /** {@code <recycleRoot>/<batchId>}, or null when the id does not name a direct child. */
    private Path batchRoot(String batchId) {
        final Path root;
        try {
            root = recycleRoot.resolve(batchId).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
        if (root.equals(recycleRoot) || !recycleRoot.equals(root.getParent())) return null;
        return root;
    }

    private static boolean entriesUnder(Batch batch, Path batchRoot) {
        for (AuditRecord entry : batch.entries()) {
            Path p = PathSafety.parse(entry.recyclePath());
            if (p == null) return false;
            Path abs = p.toAbsolutePath().normalize();
            if (abs.equals(batchRoot) || !PathSafety.isAllowed(batchRoot, abs)) return false;
        }
        return true;
    }

    private static BatchFailure refuse(Batch batch, String reason, String message) {
        log.warning(() -> "Refusing to delete batch " + batch.batchId() + ": " + reason);
        return new BatchFailure(batch.batchId(), message, ErrorKind.PATH_VALIDATION_FAILED, reason);
    }

    private void appendRecord(MaintenanceSummary s, long time) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("enabled", s.policy().enabled());
        policy.put("maxAgeDays", s.policy().maxAgeDays());
        policy.put("minKeepBatches", s.policy().minKeepBatches());
        policy.put("sizeThresholdGB", s.policy().sizeThresholdGB());

        AuditRecord rec = AuditRecord.builder(AuditAction.RECYCLE_MAINTAIN)
                .time(time)
                .status(s.status())
                .dryRun(s.dryRun())
                .put("recycle_root", recycleRoot.toString())
                .put("policy", policy)
                .put("threshold_bytes", s.thresholdBytes())
                .put("over_threshold", s.overThreshold())
                .put("before_batches", s.before().totalBatches())
                .put("before_bytes", s.before().totalBytes())
                .put("deleted_batches", s.deletedBatches())
                .put("deleted_bytes", s.deletedBytes())
                .put("failed_batches", s.failedBatches())
                .put("selected_by_age", s.selectedByAge())
                .put("selected_by_size", s.selectedBySize())
                .put("remaining_batches", s.after().totalBatches())
                .put("remaining_bytes", s.after().totalBytes())
                .put("error_type", s.failures().isEmpty() ? null : s.failures().get(0).kind().wire())
                .build();
        auditLog.append(rec);
    }
}
