package io.trashlite.storage.retention;

import io.trashlite.core.Batch;

import java.util.List;

/**
 * Snapshot of the recycle bin.
 * <p>
 * {@code totalBytes} is measured on disk under the recycle root (orphans included);
 * {@code indexedBytes} is the sum of declared sizes of restorable batches.
 * {@code oldestTime} is null when there are no batches.
 */
public record RecycleStats(List<Batch> batches, long totalBytes, long indexedBytes, Long oldestTime) {
    public RecycleStats {
        batches = List.copyOf(batches);
    }

    public int totalBatches() {
        return batches.size();
    }
}
