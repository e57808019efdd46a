package io.trashlite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilesPathMoverTest {

    @TempDir Path tmp;

    /** Behaves like a mover whose source and target sit on different devices. */
    private static final class CrossDeviceMover extends FilesPathMover {
        int renameAttempts;

        @Override
        protected void rename(Path source, Path target) throws IOException {
            renameAttempts++;
            throw new AtomicMoveNotSupportedException(source.toString(), target.toString(), "cross-device link");
        }
    }

    private Path tree(String name) throws IOException {
        Path root = Files.createDirectories(tmp.resolve(name));
        Files.writeString(root.resolve("a.txt"), "hello");
        Files.createDirectories(root.resolve("sub/deeper"));
        Files.writeString(root.resolve("sub/deeper/b.txt"), "world");
        return root;
    }

    @Test
    void rename_moves_a_tree_and_creates_missing_parents() throws Exception {
        Path src = tree("src");
        Path dst = tmp.resolve("bin/batch/0001_src");

        new FilesPathMover().move(src, dst);

        assertFalse(Files.exists(src));
        assertEquals("hello", Files.readString(dst.resolve("a.txt")));
        assertEquals("world", Files.readString(dst.resolve("sub/deeper/b.txt")));
    }

    @Test
    void cross_device_falls_back_to_copy_then_delete() throws Exception {
        Path src = tree("src");
        Path dst = tmp.resolve("other-device/0001_src");
        var mover = new CrossDeviceMover();

        mover.move(src, dst);

        assertEquals(1, mover.renameAttempts);
        assertFalse(Files.exists(src), "source must be removed after the copy");
        assertEquals("hello", Files.readString(dst.resolve("a.txt")));
        assertEquals("world", Files.readString(dst.resolve("sub/deeper/b.txt")));
    }

    @Test
    void cross_device_fallback_handles_a_single_file() throws Exception {
        Path src = Files.writeString(tmp.resolve("single.bin"), "12345");
        Path dst = tmp.resolve("elsewhere/0001_single.bin");

        new CrossDeviceMover().move(src, dst);

        assertFalse(Files.exists(src));
        assertEquals("12345", Files.readString(dst));
    }

    @Test
    void delete_recursively_removes_tree_and_ignores_missing_paths() throws Exception {
        Path root = tree("doomed");
        var mover = new FilesPathMover();

        mover.deleteRecursively(root);
        assertFalse(Files.exists(root));

        assertDoesNotThrow(() -> mover.deleteRecursively(tmp.resolve("never-existed")));
    }
}
