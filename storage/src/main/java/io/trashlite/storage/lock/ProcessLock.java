// file: src/main/java/io/trashlite/storage/lock/ProcessLock.java
package io.trashlite.storage.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Cooperative single-instance lock for one state directory.
 * <p>
 * States:
 *  - unlocked:      no {@code <stateRoot>/.lockfile}.
 *  - held-by-self:  this process created the file with CREATE_NEW.
 * <p>
 * acquire():
 *  1) exclusive create of the lock file, holding a {@link LockInfo} JSON object;
 *  2) on conflict, read the owner record and probe its pid:
 *      - alive -> {@link LockHeldException} ("already running ...");
 *      - dead, unreadable, or no pid -> stale: delete the file and retry exactly once,
 *        marking the new record recoveredFromStale.
 * <p>
 * The lock is advisory: it only protects callers that also take it. Liveness probing
 * can race with pid reuse, so recovery is a single bounded retry, never a loop.
 * <p>
 * release() (or close()) deletes the file if it still names this pid. A JVM shutdown
 * hook does the same when the holder forgets or the process is interrupted.
 */
public final class ProcessLock implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ProcessLock.class.getName());
    static final String LOCK_FILE_NAME = ".lockfile";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final LongPredicate PROCESS_ALIVE =
            pid -> pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);

    private final Path lockPath;
    private final LockInfo info;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Thread shutdownHook;

    private ProcessLock(Path lockPath, LockInfo info) {
        this.lockPath = lockPath;
        this.info = info;
        this.shutdownHook = new Thread(this::releaseQuietly, "trash-lite-lock-release");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public static Path lockPath(Path stateRoot) {
        return stateRoot.toAbsolutePath().normalize().resolve(LOCK_FILE_NAME);
    }

    public static ProcessLock acquire(Path stateRoot, String mode) {
        return acquire(stateRoot, mode, PROCESS_ALIVE, Clock.systemUTC());
    }

    /**
     * @param isAlive liveness probe for the pid found in an existing lock file
     */
    public static ProcessLock acquire(Path stateRoot, String mode, LongPredicate isAlive, Clock clock) {
        Objects.requireNonNull(stateRoot, "stateRoot");
        Objects.requireNonNull(isAlive, "isAlive");
        Objects.requireNonNull(clock, "clock");
        Path lockPath = lockPath(stateRoot);
        long selfPid = ProcessHandle.current().pid();
        String safeMode = mode == null || mode.isBlank() ? "unknown" : mode;

        try {
            Files.createDirectories(lockPath.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create state directory " + lockPath.getParent(), e);
        }

        LockInfo stale = null;
        boolean recovered = false;
        for (int attempt = 0; attempt < 2; attempt++) {
            LockInfo payload = recovered
                    ? new LockInfo(selfPid, safeMode, hostname(), clock.millis(), true, clock.millis(),
                            stale == null ? null : stale.pid())
                    : new LockInfo(selfPid, safeMode, hostname(), clock.millis(), null, null, null);
            try {
                writeExclusive(lockPath, payload);
                if (recovered) {
                    log.warning(() -> "Recovered stale lock " + lockPath + " left by pid "
                            + (payload.staleLockPid() == null ? "?" : payload.staleLockPid()));
                }
                return new ProcessLock(lockPath, payload);
            } catch (FileAlreadyExistsException e) {
                LockInfo owner = readInfo(lockPath).orElse(null);
                long ownerPid = owner == null || owner.pid() == null ? -1L : owner.pid();
                boolean isStale = ownerPid <= 0 || !isAlive.test(ownerPid);

                if (isStale && attempt == 0) {
                    stale = owner;
                    recovered = true;
                    try {
                        Files.deleteIfExists(lockPath);
                    } catch (IOException deleteFailure) {
                        throw new UncheckedIOException("Cannot remove stale lock " + lockPath, deleteFailure);
                    }
                    continue;
                }

                String message = isStale
                        ? "Lock file conflict persisted after stale-lock recovery: " + lockPath
                        : "Another instance is already running ("
                            + (owner == null ? "owner unknown" : owner.describe()) + "), lock: " + lockPath;
                throw new LockHeldException(message, lockPath, owner, isStale);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create lock file " + lockPath, e);
            }
        }
        throw new LockHeldException("Lock file conflict persisted after stale-lock recovery: " + lockPath,
                lockPath, stale, true);
    }

    /** Current owner of the state directory, without acquiring. */
    public static Optional<LockInfo> inspect(Path stateRoot) {
        return readInfo(lockPath(stateRoot));
    }

    /** Remove the lock file unconditionally. Returns true when a file was removed. */
    public static boolean breakLock(Path stateRoot) {
        try {
            return Files.deleteIfExists(lockPath(stateRoot));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot remove lock " + lockPath(stateRoot), e);
        }
    }

    public Path path() {
        return lockPath;
    }

    public LockInfo info() {
        return info;
    }

    public boolean recoveredFromStale() {
        return Boolean.TRUE.equals(info.recoveredFromStale());
    }

    /** Idempotent. */
    public void release() {
        if (!releaseQuietly()) return;
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException shuttingDown) {
            // the hook is already running or done
        }
    }

    @Override
    public void close() {
        release();
    }

    private boolean releaseQuietly() {
        if (!released.compareAndSet(false, true)) return false;
        try {
            Optional<LockInfo> current = readInfo(lockPath);
            if (current.isPresent() && !Objects.equals(current.get().pid(), info.pid())) {
                log.warning(() -> "Lock " + lockPath + " now belongs to pid " + current.get().pid() + ", leaving it");
                return true;
            }
            Files.deleteIfExists(lockPath);
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to remove lock file " + lockPath, e);
        }
        return true;
    }

    private static void writeExclusive(Path lockPath, LockInfo payload) throws IOException {
        byte[] bytes = (MAPPER.writeValueAsString(payload) + "\n").getBytes(StandardCharsets.UTF_8);
        try (OutputStream out = Files.newOutputStream(lockPath, CREATE_NEW, WRITE)) {
            out.write(bytes);
        }
    }

    private static Optional<LockInfo> readInfo(Path lockPath) {
        if (!Files.exists(lockPath)) return Optional.empty();
        try {
            return Optional.ofNullable(MAPPER.readValue(lockPath.toFile(), LockInfo.class));
        } catch (IOException e) {
            log.log(Level.FINE, "Unreadable lock file " + lockPath, e);
            return Optional.empty();
        }
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }
}
