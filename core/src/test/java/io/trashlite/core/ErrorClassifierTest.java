package io.trashlite.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void nio_exception_types_map_directly() {
        assertEquals(ErrorKind.PERMISSION_DENIED, ErrorClassifier.classify(new AccessDeniedException("/x")));
        assertEquals(ErrorKind.PATH_NOT_FOUND, ErrorClassifier.classify(new NoSuchFileException("/x")));
        assertEquals(ErrorKind.DIR_NOT_EMPTY, ErrorClassifier.classify(new DirectoryNotEmptyException("/x")));
    }

    @Test
    void wrapped_cause_is_classified() {
        var wrapped = new RuntimeException("move failed", new AccessDeniedException("/x"));
        assertEquals(ErrorKind.PERMISSION_DENIED, ErrorClassifier.classify(wrapped));
    }

    @Test
    void generic_filesystem_error_falls_back_to_reason_text() {
        var full = new FileSystemException("/x", null, "No space left on device");
        assertEquals(ErrorKind.DISK_FULL, ErrorClassifier.classify(full));
        var ro = new FileSystemException("/x", null, "Read-only file system");
        assertEquals(ErrorKind.READ_ONLY, ErrorClassifier.classify(ro));
    }

    @Test
    void errno_style_messages_are_recognized() {
        assertEquals(ErrorKind.PERMISSION_DENIED, ErrorClassifier.classify("EACCES: permission denied, rename"));
        assertEquals(ErrorKind.PATH_NOT_FOUND, ErrorClassifier.classify("ENOENT: no such file or directory"));
        assertEquals(ErrorKind.DIR_NOT_EMPTY, ErrorClassifier.classify("ENOTEMPTY: directory not empty"));
        assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify("operation timeout"));
        assertEquals(ErrorKind.DISK_FULL, ErrorClassifier.classify("ENOSPC"));
        assertEquals(ErrorKind.READ_ONLY, ErrorClassifier.classify("EROFS: read-only file system"));
        assertEquals(ErrorKind.PATH_VALIDATION_FAILED, ErrorClassifier.classify("path escapes root"));
    }

    @Test
    void blank_or_unmatched_is_unknown() {
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify((String) null));
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(""));
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(new IOException("boom")));
    }

    @Test
    void describe_keeps_exception_type_for_bare_path_messages() {
        assertEquals("NoSuchFileException: /x", ErrorClassifier.describe(new NoSuchFileException("/x")));
        assertEquals("boom", ErrorClassifier.describe(new IOException("boom")));
        assertEquals("IOException", ErrorClassifier.describe(new IOException()));
    }

    @Test
    void wire_lookup_is_lenient() {
        assertEquals(ErrorKind.DISK_FULL, ErrorKind.fromWire("disk_full"));
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.fromWire("nope"));
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.fromWire(null));
    }
}
