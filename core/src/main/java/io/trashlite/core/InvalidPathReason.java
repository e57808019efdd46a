package io.trashlite.core;

/**
 * Reason codes recorded in {@code invalid_reason} when a path fails the allow-list check.
 */
public enum InvalidPathReason {
    /** Not under any configured scan or governance root. */
    SOURCE_OUTSIDE_ALLOWED_ROOT("source_outside_allowed_root"),
    /** Restore destination not under the profile root or its extra roots. */
    SOURCE_OUTSIDE_PROFILE_ROOT("source_outside_profile_root"),
    /** Missing, blank, or syntactically invalid path. */
    SOURCE_PATH_UNRESOLVABLE("source_path_unresolvable"),
    /** A log entry's recyclePath does not live under the recycle root. */
    RECYCLE_OUTSIDE_RECYCLE_ROOT("recycle_outside_recycle_root");

    private final String wire;

    InvalidPathReason(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
