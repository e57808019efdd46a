// file: src/main/java/io/trashlite/storage/FilesPathMover.java
package io.trashlite.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * {@link PathMover} over java.nio.file.
 * <p>
 * move():
 *  1) try an atomic rename (same filesystem: O(1), crash-safe);
 *  2) if the filesystem refuses ({@link AtomicMoveNotSupportedException}, the
 *     cross-device case), copy the tree to the target and then delete the source.
 * <p>
 * Limitation: step 2 is not crash-atomic. A crash between copy and delete leaves the
 * content in both places; a crash during the copy leaves a partial target. Nothing here
 * tries to hide or repair that.
 */
public class FilesPathMover implements PathMover {
    private static final Logger log = Logger.getLogger(FilesPathMover.class.getName());

    @Override
    public void move(Path source, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try {
            rename(source, target);
            return;
        } catch (AtomicMoveNotSupportedException e) {
            log.log(Level.FINE, "Rename not supported for {0} -> {1}, copying", new Object[]{source, target});
        }
        copyTree(source, target);
        deleteRecursively(source);
    }

    /** Atomic rename; overridable so tests can simulate a cross-device move. */
    protected void rename(Path source, Path target) throws IOException {
        Files.move(source, target, ATOMIC_MOVE);
    }

    @Override
    public void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) return;
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.deleteIfExists(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) return FileVisitResult.CONTINUE;
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void copyTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source, LinkOption.NOFOLLOW_LINKS)) {
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
            return;
        }
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
