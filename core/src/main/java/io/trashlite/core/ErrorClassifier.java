// file: src/main/java/io/trashlite/core/ErrorClassifier.java
package io.trashlite.core;

import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.ReadOnlyFileSystemException;
import java.util.Locale;

/**
 * Maps filesystem failures onto {@link ErrorKind}.
 * <p>
 * Two passes:
 *  1) well-known NIO exception types (walking the cause chain),
 *  2) substring matching on the lower-cased message text, which also covers
 *     errno-style messages ("EACCES", "ENOSPC", ...) coming from other tools.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // utility
    }

    public static ErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof AccessDeniedException) return ErrorKind.PERMISSION_DENIED;
            if (t instanceof NoSuchFileException || t instanceof NotDirectoryException) return ErrorKind.PATH_NOT_FOUND;
            if (t instanceof DirectoryNotEmptyException) return ErrorKind.DIR_NOT_EMPTY;
            if (t instanceof FileAlreadyExistsException) return ErrorKind.CONFLICT;
            if (t instanceof ReadOnlyFileSystemException) return ErrorKind.READ_ONLY;
        }
        return classify(describe(error));
    }

    public static ErrorKind classify(String message) {
        if (message == null || message.isBlank()) return ErrorKind.UNKNOWN;
        String text = message.toLowerCase(Locale.ROOT);

        if (containsAny(text, "eacces", "eperm", "operation not permitted", "permission denied", "access denied")) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (containsAny(text, "enoent", "enotdir", "not found", "no such file")) {
            return ErrorKind.PATH_NOT_FOUND;
        }
        if (containsAny(text, "invalid", "illegal", "outside", "escape")) {
            return ErrorKind.PATH_VALIDATION_FAILED;
        }
        if (containsAny(text, "enotempty", "not empty")) {
            return ErrorKind.DIR_NOT_EMPTY;
        }
        if (containsAny(text, "timeout", "timed out")) {
            return ErrorKind.TIMEOUT;
        }
        if (containsAny(text, "enospc", "no space")) {
            return ErrorKind.DISK_FULL;
        }
        if (containsAny(text, "read-only", "readonly", "erofs")) {
            return ErrorKind.READ_ONLY;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Message text used both for classification and for the {@code error} field:
     * the exception's message, falling back to its simple class name.
     */
    public static String describe(Throwable error) {
        if (error == null) return "";
        String msg = error.getMessage();
        if (msg == null || msg.isBlank()) return error.getClass().getSimpleName();
        // NIO exceptions carry only the path as message; keep the type visible.
        if (error instanceof FileSystemException fse && fse.getReason() == null) {
            return error.getClass().getSimpleName() + ": " + msg;
        }
        return msg;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String n : needles) {
            if (text.contains(n)) return true;
        }
        return false;
    }
}
