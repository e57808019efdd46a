package io.trashlite.storage.lock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProcessLockTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    private static final long SELF = ProcessHandle.current().pid();

    @TempDir Path state;

    @Test
    void acquire_writes_owner_record_and_release_removes_it() {
        ProcessLock lock = ProcessLock.acquire(state, "cleanup");
        Path file = state.resolve(ProcessLock.LOCK_FILE_NAME);
        assertTrue(Files.exists(file));

        LockInfo info = ProcessLock.inspect(state).orElseThrow();
        assertEquals(SELF, info.pid());
        assertEquals("cleanup", info.mode());
        assertNull(info.recoveredFromStale());
        assertFalse(lock.recoveredFromStale());

        lock.release();
        assertFalse(Files.exists(file));
        assertDoesNotThrow(lock::release);
        assertDoesNotThrow(lock::close);
    }

    @Test
    void live_owner_blocks_a_second_acquire() {
        try (ProcessLock held = ProcessLock.acquire(state, "restore")) {
            LockHeldException e = assertThrows(LockHeldException.class,
                    () -> ProcessLock.acquire(state, "cleanup"));
            assertFalse(e.stale());
            assertEquals(SELF, e.owner().pid());
            assertEquals("restore", e.owner().mode());
            assertTrue(e.getMessage().contains("already running"), e.getMessage());
            assertEquals(held.path(), e.lockPath());
        }
        assertTrue(ProcessLock.inspect(state).isEmpty());
    }

    @Test
    void dead_owner_is_recovered_once_and_marked() throws Exception {
        Files.writeString(state.resolve(ProcessLock.LOCK_FILE_NAME),
                "{\"pid\":424242,\"mode\":\"cleanup\",\"hostname\":\"old-box\",\"startedAt\":1}");

        try (ProcessLock lock = ProcessLock.acquire(state, "recycle_maintain", pid -> false, CLOCK)) {
            assertTrue(lock.recoveredFromStale());
            LockInfo info = ProcessLock.inspect(state).orElseThrow();
            assertEquals(SELF, info.pid());
            assertEquals(Boolean.TRUE, info.recoveredFromStale());
            assertEquals(424242L, info.staleLockPid());
            assertEquals(CLOCK.millis(), info.recoveredAt());
        }
    }

    @Test
    void unreadable_lock_file_counts_as_stale() throws Exception {
        Files.writeString(state.resolve(ProcessLock.LOCK_FILE_NAME), "garbage{");

        try (ProcessLock lock = ProcessLock.acquire(state, "cleanup", pid -> true, CLOCK)) {
            assertTrue(lock.recoveredFromStale());
            assertNull(lock.info().staleLockPid());
        }
    }

    @Test
    void release_leaves_a_lock_that_now_names_another_pid() throws Exception {
        ProcessLock lock = ProcessLock.acquire(state, "cleanup");
        Path file = lock.path();
        Files.writeString(file, "{\"pid\":1,\"mode\":\"cleanup\"}");

        lock.release();

        assertTrue(Files.exists(file));
        assertEquals(Optional.of(1L), ProcessLock.inspect(state).map(LockInfo::pid));
    }

    @Test
    void break_lock_removes_file_unconditionally() {
        ProcessLock.acquire(state, "cleanup");
        assertTrue(ProcessLock.breakLock(state));
        assertFalse(ProcessLock.breakLock(state));
        assertTrue(ProcessLock.inspect(state).isEmpty());
    }

    @Test
    void describe_is_human_readable() {
        LockInfo info = new LockInfo(12L, "restore", "host-a", 0L, null, null, null);
        assertEquals("pid 12, mode restore, host host-a, since 1970-01-01T00:00:00Z", info.describe());
    }
}
