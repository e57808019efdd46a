package io.trashlite.storage;

import java.util.List;

/**
 * Aggregate result of one cleanup run, for report rendering.
 * <p>
 * successCount + skippedCount + failedCount always equals the number of targets.
 * Dry-run items count as successes and contribute their declared bytes.
 */
public record CleanupSummary(
        String batchId,
        boolean dryRun,
        int successCount,
        int skippedCount,
        int failedCount,
        long reclaimedBytes,
        List<ItemFailure> failures
) {
    public CleanupSummary {
        failures = List.copyOf(failures);
    }

    public int total() {
        return successCount + skippedCount + failedCount;
    }
}
