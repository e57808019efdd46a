package io.trashlite.storage;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Best-effort on-disk size of a file or tree. Symlinks are not followed and
 * unreadable entries count as 0; this is for reporting, never for decisions.
 */
public final class DiskUsage {

    private DiskUsage() {
        // utility
    }

    public static long sizeOf(Path path) {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) return 0L;
        long[] total = {0L};
        try {
            Files.walkFileTree(path, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) total[0] += attrs.size();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            return total[0];
        }
        return total[0];
    }
}
