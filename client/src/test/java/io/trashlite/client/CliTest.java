package io.trashlite.client;

import io.trashlite.core.Batch;
import io.trashlite.storage.RecycleBin;
import io.trashlite.storage.RecycleBinSettings;
import io.trashlite.storage.lock.ProcessLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @TempDir Path tmp;

    private Path state;
    private Path profiles;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws Exception {
        state = tmp.resolve("state");
        profiles = Files.createDirectories(tmp.resolve("profiles"));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String stdin, String... args) {
        Cli cli = new Cli(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                tmp.resolve("home"));
        return cli.run(args);
    }

    private String[] withRoots(String... rest) {
        String[] base = {"--state-root", state.toString(), "--profile-root", profiles.toString()};
        String[] all = new String[base.length + rest.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(rest, 0, all, base.length, rest.length);
        return all;
    }

    private List<Batch> batches() {
        return new RecycleBin(RecycleBinSettings.under(state)).listRestorableBatches();
    }

    @Test
    void cleanup_is_a_dry_run_unless_asked_otherwise() throws Exception {
        Path dir = Files.createDirectories(profiles.resolve("acc1/cache/2024-01"));
        Files.writeString(dir.resolve("data.bin"), "hello");

        assertEquals(0, run("", withRoots("cleanup", dir.toString())));
        assertTrue(Files.exists(dir));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("[dry run]"));

        assertEquals(0, run("", withRoots("--no-dry-run", "cleanup", dir.toString())));
        assertFalse(Files.exists(dir));
        assertEquals(1, batches().size());
        assertEquals(5L, batches().get(0).totalBytes());
    }

    @Test
    void restore_with_ask_reads_the_answer_from_stdin() throws Exception {
        Path dir = Files.createDirectories(profiles.resolve("acc1/cache/a"));
        Files.writeString(dir.resolve("data.bin"), "old");
        assertEquals(0, run("", withRoots("--no-dry-run", "cleanup", dir.toString())));
        String batchId = batches().get(0).batchId();

        Files.createDirectories(dir);
        Files.writeString(dir.resolve("data.bin"), "replacement");

        assertEquals(0, run("o\n", withRoots("--no-dry-run", "--conflict", "ask", "restore", batchId)));
        assertEquals("old", Files.readString(dir.resolve("data.bin")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Destination exists"));
        assertTrue(batches().isEmpty());
    }

    @Test
    void unknown_batch_is_a_usage_error() {
        assertEquals(1, run("", withRoots("--no-dry-run", "restore", "20240101-000000-abcdef")));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("No restorable batch"));
    }

    @Test
    void lock_and_unlock_commands() {
        assertEquals(0, run("", withRoots("lock")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("unlocked"));

        ProcessLock.acquire(state, "cleanup");
        assertEquals(0, run("", withRoots("lock")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("mode cleanup"));

        assertEquals(1, run("", withRoots("maintain")), "held lock is reported, not thrown");

        assertEquals(0, run("", withRoots("unlock")));
        assertTrue(ProcessLock.inspect(state).isEmpty());
    }

    @Test
    void maintain_and_stats_on_an_empty_bin() {
        assertEquals(0, run("", withRoots("maintain")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("skipped_no_candidate"));
        assertEquals(0, run("", withRoots("stats")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("batches:       0"));
        assertEquals(0, run("", withRoots("batches")));
    }

    @Test
    void usage_and_configuration_errors_exit_with_1() {
        assertEquals(1, run(""));
        assertEquals(1, run("", withRoots("frobnicate")));
        assertEquals(1, run("", withRoots("restore")));
        assertEquals(1, run("", "--config", tmp.resolve("missing.json").toString(), "stats"));
        assertEquals(0, run("", "--help"));
    }

    @Test
    void human_sizes() {
        assertEquals("512 B", Cli.human(512));
        assertEquals("1.5 KB", Cli.human(1536));
        assertEquals("2.0 GB", Cli.human(2L << 30));
    }
}
