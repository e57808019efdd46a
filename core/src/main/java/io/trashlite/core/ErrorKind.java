package io.trashlite.core;

/**
 * Machine-readable failure kinds carried by audit records ({@code errorType}).
 * <p>
 * Kinds exist for reporting and downstream filtering only; no code path branches on them.
 */
public enum ErrorKind {
    PERMISSION_DENIED("permission_denied", "Permission denied"),
    PATH_NOT_FOUND("path_not_found", "Path not found"),
    PATH_VALIDATION_FAILED("path_validation_failed", "Path validation failed"),
    DIR_NOT_EMPTY("dir_not_empty", "Directory not empty"),
    TIMEOUT("timeout", "Timed out"),
    DISK_FULL("disk_full", "Disk full"),
    READ_ONLY("read_only", "Read-only location"),
    CONFLICT("conflict", "Path conflict"),
    POLICY_SKIPPED("policy_skipped", "Skipped by policy"),
    UNKNOWN("unknown", "Other error");

    private final String wire;
    private final String label;

    ErrorKind(String wire, String label) {
        this.wire = wire;
        this.label = label;
    }

    public String wire() {
        return wire;
    }

    /** Human label for report rendering. */
    public String label() {
        return label;
    }

    /** Lenient lookup; anything unrecognized maps to UNKNOWN. */
    public static ErrorKind fromWire(String value) {
        if (value != null) {
            for (ErrorKind k : values()) {
                if (k.wire.equals(value)) return k;
            }
        }
        return UNKNOWN;
    }
}
