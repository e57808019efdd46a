package io.trashlite.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem side effects of the recycle bin, kept behind one seam so the engines'
 * decision logic can be exercised against failures that are hard to provoke on disk.
 */
public interface PathMover {

    /**
     * Move {@code source} to {@code target}, creating the target's parent directories.
     * The target must not exist.
     */
    void move(Path source, Path target) throws IOException;

    /** Remove a file or a whole directory tree. Missing paths are ignored. */
    void deleteRecursively(Path path) throws IOException;
}
