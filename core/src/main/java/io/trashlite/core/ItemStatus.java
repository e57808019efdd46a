package io.trashlite.core;

/**
 * Per-item outcome written to cleanup and restore records.
 */
public enum ItemStatus {
    SUCCESS("success"),
    DRY_RUN("dry_run"),
    FAILED("failed"),
    SKIPPED_MISSING_SOURCE("skipped_missing_source"),
    SKIPPED_MISSING_RECYCLE("skipped_missing_recycle"),
    SKIPPED_INVALID_PATH("skipped_invalid_path"),
    SKIPPED_CONFLICT("skipped_conflict"),
    SKIPPED_POLICY_PROTECTED("skipped_policy_protected"),
    SKIPPED_RECENTLY_ACTIVE("skipped_recently_active");

    private final String wire;

    ItemStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public boolean isSkip() {
        return wire.startsWith("skipped_");
    }
}
