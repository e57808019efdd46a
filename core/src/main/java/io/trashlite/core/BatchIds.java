package io.trashlite.core;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Batch id generation: {@code yyyyMMdd-HHmmss-<6 hex>} in the clock's zone.
 * <p>
 * The timestamp prefix makes ids sort chronologically as plain strings;
 * the random suffix separates two runs started in the same second.
 */
public final class BatchIds {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT);
    private static final Pattern SHAPE = Pattern.compile("\\d{8}-\\d{6}-[0-9a-f]{6}");

    private BatchIds() {
        // utility
    }

    public static String generate(Clock clock, Random random) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(random, "random");
        byte[] suffix = new byte[3];
        random.nextBytes(suffix);
        return STAMP.format(LocalDateTime.now(clock)) + "-" + HexFormat.of().formatHex(suffix);
    }

    public static boolean isWellFormed(String batchId) {
        return batchId != null && SHAPE.matcher(batchId).matches();
    }
}
