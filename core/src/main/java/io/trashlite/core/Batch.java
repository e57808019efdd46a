package io.trashlite.core;

import java.util.List;
import java.util.Objects;

/**
 * Restorable view of one cleanup run, derived from the audit log.
 * <p>
 * Fields:
 *  - batchId:    sortable id shared by every record of the run.
 *  - firstTime:  earliest record timestamp in the batch (epoch millis).
 *  - entries:    cleanup records that were not restored yet and whose recycle path
 *                still exists on disk, in log order.
 *  - totalBytes: sum of the entries' declared sizes.
 * <p>
 * Batches are never persisted; they are recomputed from the log on every read.
 */
public record Batch(String batchId, long firstTime, List<AuditRecord> entries, long totalBytes) {
    public Batch {
        Objects.requireNonNull(batchId, "batchId");
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
