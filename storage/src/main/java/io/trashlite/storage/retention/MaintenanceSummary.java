package io.trashlite.storage.retention;

import io.trashlite.core.MaintenanceStatus;

import java.util.List;

public record MaintenanceSummary(
        MaintenanceStatus status,
        boolean dryRun,
        RetentionPolicy policy,
        RecycleStats before,
        RecycleStats after,
        long thresholdBytes,
        boolean overThreshold,
        int candidateCount,
        int selectedByAge,
        int selectedBySize,
        int deletedBatches,
        long deletedBytes,
        List<BatchFailure> failures
) {
    public MaintenanceSummary {
        failures = List.copyOf(failures);
    }

    public int failedBatches() {
        return failures.size();
    }
}
