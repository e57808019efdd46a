package io.trashlite.storage;

import java.util.Locale;

/**
 * What to do when a restore destination already exists.
 *  - SKIP:      leave both the destination and the recycle item untouched.
 *  - OVERWRITE: recursively remove the existing destination, then restore.
 *  - RENAME:    restore next to it as {@code <original>.restored-<epochMillis>}.
 */
public enum ConflictStrategy {
    SKIP, OVERWRITE, RENAME;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConflictStrategy parse(String value) {
        if (value == null) throw new IllegalArgumentException("conflict strategy is required");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "skip" -> SKIP;
            case "overwrite" -> OVERWRITE;
            case "rename" -> RENAME;
            default -> throw new IllegalArgumentException("unknown conflict strategy: " + value);
        };
    }
}
