package io.trashlite.core;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Naming of items inside a batch directory: {@code <4-digit seq>_<sanitized basename>}.
 */
public final class RecycleNames {
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    private RecycleNames() {
        // utility
    }

    /**
     * Keep only {@code [A-Za-z0-9._-]}; every other character becomes {@code _}.
     * An empty basename (e.g. a filesystem root) becomes {@code unknown}.
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) return "unknown";
        String cleaned = UNSAFE.matcher(name).replaceAll("_");
        return cleaned.isEmpty() ? "unknown" : cleaned;
    }

    /** @param seq 1-based position of the target in its cleanup run */
    public static String itemName(int seq, Path source) {
        if (seq < 1) throw new IllegalArgumentException("seq must be >= 1");
        Path file = source.getFileName();
        return String.format("%04d_%s", seq, sanitize(file == null ? "" : file.toString()));
    }
}
