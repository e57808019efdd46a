package io.trashlite.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RecycleNamesTest {

    @Test
    void sanitize_keeps_safe_characters_only() {
        assertEquals("cache-2024_01.v2", RecycleNames.sanitize("cache-2024_01.v2"));
        assertEquals("my_dir__x_", RecycleNames.sanitize("my dir (x)"));
        assertEquals("__", RecycleNames.sanitize("文件"));
        assertEquals("unknown", RecycleNames.sanitize(""));
        assertEquals("unknown", RecycleNames.sanitize(null));
    }

    @Test
    void item_name_is_zero_padded_sequence_plus_basename() {
        assertEquals("0001_2024-01", RecycleNames.itemName(1, Path.of("/p/acc/File/2024-01")));
        assertEquals("0123_a_b", RecycleNames.itemName(123, Path.of("/p/a b")));
        assertThrows(IllegalArgumentException.class, () -> RecycleNames.itemName(0, Path.of("/x")));
    }

    @Test
    void batch_id_has_timestamp_and_random_suffix() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.UTC);
        String id = BatchIds.generate(clock, new Random(42));
        assertTrue(id.startsWith("20240305-070809-"), id);
        assertTrue(BatchIds.isWellFormed(id), id);
        assertFalse(BatchIds.isWellFormed("../etc"));
    }

    @Test
    void batch_ids_sort_chronologically() {
        String a = BatchIds.generate(Clock.fixed(Instant.parse("2024-01-31T23:59:59Z"), ZoneOffset.UTC), new Random(1));
        String b = BatchIds.generate(Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC), new Random(2));
        assertTrue(a.compareTo(b) < 0);
    }
}
