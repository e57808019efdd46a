package io.trashlite.core;

/**
 * Outcome of one retention run, written to the recycle_maintain record.
 */
public enum MaintenanceStatus {
    SUCCESS("success"),
    DRY_RUN("dry_run"),
    PARTIAL_FAILED("partial_failed"),
    SKIPPED_DISABLED("skipped_disabled"),
    SKIPPED_NO_CANDIDATE("skipped_no_candidate");

    private final String wire;

    MaintenanceStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
