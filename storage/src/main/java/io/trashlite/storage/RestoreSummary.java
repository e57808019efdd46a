package io.trashlite.storage;

import java.util.List;

/**
 * Aggregate result of restoring one batch.
 */
public record RestoreSummary(
        String batchId,
        boolean dryRun,
        int successCount,
        int skipCount,
        int failCount,
        long restoredBytes,
        List<ItemFailure> failures
) {
    public RestoreSummary {
        failures = List.copyOf(failures);
    }
}
