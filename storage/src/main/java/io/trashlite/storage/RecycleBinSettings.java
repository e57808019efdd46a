package io.trashlite.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Filesystem layout of one recycle bin.
 *
 * @param stateRoot   directory holding the lock file (and, by default, everything else)
 * @param recycleRoot batch directories live directly under it
 * @param indexPath   the JSONL audit log
 */
public record RecycleBinSettings(Path stateRoot, Path recycleRoot, Path indexPath) {
    public static final String DEFAULT_RECYCLE_DIR = "recycle-bin";
    public static final String DEFAULT_INDEX_FILE = "index.jsonl";

    public RecycleBinSettings {
        stateRoot = Objects.requireNonNull(stateRoot, "stateRoot").toAbsolutePath().normalize();
        recycleRoot = recycleRoot == null
                ? stateRoot.resolve(DEFAULT_RECYCLE_DIR)
                : recycleRoot.toAbsolutePath().normalize();
        indexPath = indexPath == null
                ? stateRoot.resolve(DEFAULT_INDEX_FILE)
                : indexPath.toAbsolutePath().normalize();
    }

    /** Default layout under one state directory. */
    public static RecycleBinSettings under(Path stateRoot) {
        return new RecycleBinSettings(stateRoot, null, null);
    }
}
