package io.trashlite.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    void flags_can_appear_anywhere_and_positionals_are_kept_in_order() {
        CliOptions o = CliOptions.fromArgs(new String[]{
                "--state-root", "/tmp/state", "cleanup", "/p/a", "--no-dry-run", "/p/b", "--scope", "space_governance"});

        assertEquals("/tmp/state", o.stateRoot());
        assertEquals("cleanup", o.command());
        assertEquals(List.of("/p/a", "/p/b"), o.arguments());
        assertEquals(Boolean.FALSE, o.dryRun());
        assertEquals("space_governance", o.scope());
        assertFalse(o.help());
    }

    @Test
    void unset_flags_stay_null() {
        CliOptions o = CliOptions.fromArgs(new String[]{"batches"});
        assertNull(o.configPath());
        assertNull(o.dryRun());
        assertNull(o.conflict());
        assertTrue(o.arguments().isEmpty());
    }

    @Test
    void conflict_values_are_normalized_and_validated() {
        assertEquals("overwrite", CliOptions.fromArgs(new String[]{"--conflict", "OVERWRITE"}).conflict());
        assertEquals("ask", CliOptions.fromArgs(new String[]{"--conflict", "ask"}).conflict());
        assertThrows(CliException.class, () -> CliOptions.fromArgs(new String[]{"--conflict", "merge"}));
    }

    @Test
    void missing_value_and_unknown_option_are_usage_errors() {
        CliException missing = assertThrows(CliException.class, () -> CliOptions.fromArgs(new String[]{"--config"}));
        assertTrue(missing.getMessage().contains("--config"));
        assertThrows(CliException.class, () -> CliOptions.fromArgs(new String[]{"--bogus"}));
    }

    @Test
    void help_short_and_long() {
        assertTrue(CliOptions.fromArgs(new String[]{"-h"}).help());
        assertTrue(CliOptions.fromArgs(new String[]{"restore", "--help"}).help());
        assertTrue(CliOptions.fromArgs(new String[]{"--dry-run", "-c", "cfg.json"}).dryRun());
    }
}
