package io.trashlite.core;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One directory or file a scanner wants moved into the recycle bin.
 *
 * @param path      live path to recycle
 * @param sizeBytes size declared by the scanner; carried into the log, never re-measured
 * @param metadata  descriptive fields (account, category, month, ...) copied onto the record
 */
public record CleanupTarget(Path path, long sizeBytes, Map<String, Object> metadata) {
    public CleanupTarget {
        Objects.requireNonNull(path, "path");
        if (sizeBytes < 0) throw new IllegalArgumentException("sizeBytes must be >= 0");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public CleanupTarget(Path path, long sizeBytes) {
        this(path, sizeBytes, Map.of());
    }

    /** Metadata value as a string, or null when absent. */
    public String meta(String key) {
        Object v = metadata.get(key);
        return v == null ? null : v.toString();
    }
}
