// file: src/main/java/io/trashlite/storage/RecycleBin.java
package io.trashlite.storage;

import io.trashlite.core.Batch;
import io.trashlite.storage.lock.ProcessLock;
import io.trashlite.storage.retention.MaintenanceSummary;
import io.trashlite.storage.retention.RecycleMaintenance;
import io.trashlite.storage.retention.RecycleStats;
import io.trashlite.storage.retention.RetentionPolicy;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.LongPredicate;
import java.util.function.Supplier;

/**
 * Entry point wiring the audit log, recycle store, restore engine and retention engine
 * over one {@link RecycleBinSettings} layout.
 * <p>
 * Every mutating call runs under the state directory's {@link ProcessLock}, taken in the
 * matching mode and released when the call returns or throws. If the lock cannot be taken
 * nothing is read or written. Read-only calls take no lock.
 */
public final class RecycleBin {
    public static final String MODE_CLEANUP = "cleanup";
    public static final String MODE_RESTORE = "restore";
    public static final String MODE_MAINTAIN = "recycle_maintain";

    private final RecycleBinSettings settings;
    private final Clock clock;
    private final LongPredicate lockOwnerAlive;
    private final AuditLog auditLog;
    private final BatchReconstructor reconstructor;
    private final RecycleStore store;
    private final RestoreEngine restoreEngine;
    private final RecycleMaintenance maintenance;

    public RecycleBin(RecycleBinSettings settings) {
        this(settings, new FilesPathMover(), Clock.systemUTC(), null);
    }

    /**
     * @param lockOwnerAlive liveness probe for stale-lock detection; null uses the OS process table
     */
    public RecycleBin(RecycleBinSettings settings, PathMover mover, Clock clock, LongPredicate lockOwnerAlive) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lockOwnerAlive = lockOwnerAlive;
        this.auditLog = new JsonlAuditLog(settings.indexPath());
        this.reconstructor = new BatchReconstructor(auditLog, clock);
        this.store = new RecycleStore(auditLog, settings.recycleRoot(), mover, clock);
        this.restoreEngine = new RestoreEngine(auditLog, mover, clock);
        this.maintenance = new RecycleMaintenance(auditLog, reconstructor, settings.recycleRoot(), mover, clock);
    }

    public CleanupSummary cleanup(CleanupRequest request) {
        return locked(MODE_CLEANUP, () -> store.cleanup(request));
    }

    /**
     * Restore one batch. The request's recycle root defaults to this bin's root.
     *
     * @throws IllegalArgumentException when no restorable batch has this id
     */
    public RestoreSummary restore(String batchId, RestoreRequest request) {
        Objects.requireNonNull(request, "request");
        RestoreRequest effective = request.recycleRoot() == null
                ? request.withRecycleRoot(settings.recycleRoot())
                : request;
        return locked(MODE_RESTORE, () -> {
            Batch batch = reconstructor.findBatch(batchId)
                    .orElseThrow(() -> new IllegalArgumentException("No restorable batch: " + batchId));
            return restoreEngine.restore(batch, effective);
        });
    }

    public MaintenanceSummary maintain(RetentionPolicy policy, boolean dryRun, ProgressListener progress) {
        return locked(MODE_MAINTAIN, () -> maintenance.maintain(policy, dryRun, progress));
    }

    public List<Batch> listRestorableBatches() {
        return reconstructor.listRestorableBatches();
    }

    public RecycleStats stats() {
        return maintenance.collectStats();
    }

    public RecycleBinSettings settings() {
        return settings;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public Path recycleRoot() {
        return settings.recycleRoot();
    }

    private <T> T locked(String mode, Supplier<T> action) {
        ProcessLock lock = lockOwnerAlive == null
                ? ProcessLock.acquire(settings.stateRoot(), mode)
                : ProcessLock.acquire(settings.stateRoot(), mode, lockOwnerAlive, clock);
        try (lock) {
            return action.get();
        }
    }
}
