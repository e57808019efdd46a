package io.trashlite.storage.lock;

import java.nio.file.Path;

/**
 * Another live process holds the state directory, or stale-lock recovery lost a race.
 * Fatal to the invocation: nothing has been logged or moved when this is thrown.
 */
public class LockHeldException extends RuntimeException {
    private final Path lockPath;
    private final LockInfo owner;
    private final boolean stale;

    public LockHeldException(String message, Path lockPath, LockInfo owner, boolean stale) {
        super(message);
        this.lockPath = lockPath;
        this.owner = owner;
        this.stale = stale;
    }

    public Path lockPath() {
        return lockPath;
    }

    /** Owner record as read from disk; null when it could not be parsed. */
    public LockInfo owner() {
        return owner;
    }

    public boolean stale() {
        return stale;
    }
}
