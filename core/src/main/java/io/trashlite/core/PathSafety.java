// file: src/main/java/io/trashlite/core/PathSafety.java
package io.trashlite.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Allow-list containment check shared by cleanup (source must sit under a scan root)
 * and restore (destination must sit under a profile / governance root).
 * <p>
 * Canonical form:
 *  - absolute and normalized ("." and ".." segments folded), then
 *  - symlinks resolved for the longest prefix that exists on disk, with the
 *    not-yet-existing remainder re-appended.
 * <p>
 * For a candidate only the parent is canonicalized; its last segment is kept as-is. The
 * entry that gets moved or deleted is the link itself, so a link is judged by where it
 * lives, never by where it points.
 * <p>
 * A candidate is allowed under a root when {@code root.relativize(candidate)} neither
 * starts with a ".." segment nor is absolute, both for the plain normalized paths and for
 * their canonical forms. The root itself counts as inside.
 */
public final class PathSafety {

    private PathSafety() {
        // utility
    }

    public static boolean isAllowed(Path root, Path candidate) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(candidate, "candidate");
        return contains(root.toAbsolutePath().normalize(), candidate.toAbsolutePath().normalize())
                && contains(canonicalize(root), canonicalizeEntry(candidate));
    }

    private static boolean contains(Path root, Path candidate) {
        final Path rel;
        try {
            rel = root.relativize(candidate);
        } catch (IllegalArgumentException e) {
            // different roots / providers (e.g. another drive letter)
            return false;
        }
        if (rel.isAbsolute()) return false;
        if (rel.getNameCount() == 0 || rel.toString().isEmpty()) return true;
        return !rel.getName(0).toString().equals("..");
    }

    public static boolean isAllowedAny(Collection<Path> roots, Path candidate) {
        for (Path root : roots) {
            if (root != null && isAllowed(root, candidate)) return true;
        }
        return false;
    }

    /**
     * Validate a raw path string taken from a target list or a log entry.
     *
     * @param roots         allow-listed roots; an empty collection allows nothing
     * @param rawPath       path as recorded
     * @param outsideReason reason to report when the path resolves but no root contains it
     * @return empty when allowed, otherwise the rejection reason
     */
    public static Optional<InvalidPathReason> check(Collection<Path> roots, String rawPath, InvalidPathReason outsideReason) {
        Path candidate = parse(rawPath);
        if (candidate == null) return Optional.of(InvalidPathReason.SOURCE_PATH_UNRESOLVABLE);
        return isAllowedAny(roots, candidate) ? Optional.empty() : Optional.of(outsideReason);
    }

    /** Parse a recorded path; null when missing, blank, or not a legal path on this platform. */
    public static Path parse(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) return null;
        try {
            return Path.of(rawPath);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    static Path canonicalizeEntry(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        Path parent = abs.getParent();
        Path name = abs.getFileName();
        if (parent == null || name == null) return canonicalize(abs);
        return canonicalize(parent).resolve(name);
    }

    static Path canonicalize(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        Path existing = abs;
        Path remainder = null;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            Path name = existing.getFileName();
            remainder = remainder == null ? name : name.resolve(remainder);
            existing = existing.getParent();
        }
        if (existing == null) return abs;
        try {
            Path real = existing.toRealPath();
            return remainder == null ? real : real.resolve(remainder).normalize();
        } catch (IOException e) {
            return abs;
        }
    }
}
