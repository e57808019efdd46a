package io.trashlite.storage.retention;

/**
 * Retention knobs for the recycle bin.
 * <p>
 * Fields:
 *  - enabled:         master switch; a disabled policy still produces an audit record.
 *  - maxAgeDays:      batches at least this many whole days old are eligible (min 1).
 *  - minKeepBatches:  the newest N batches are never selected, whatever their age or size (min 1).
 *  - sizeThresholdGB: size backstop in GiB; oldest batches go first while the bin is above it (min 1).
 */
public record RetentionPolicy(boolean enabled, int maxAgeDays, int minKeepBatches, int sizeThresholdGB) {
    public static final int DEFAULT_MAX_AGE_DAYS = 30;
    public static final int DEFAULT_MIN_KEEP_BATCHES = 20;
    public static final int DEFAULT_SIZE_THRESHOLD_GB = 20;

    private static final long GIB = 1L << 30;

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(true, DEFAULT_MAX_AGE_DAYS, DEFAULT_MIN_KEEP_BATCHES, DEFAULT_SIZE_THRESHOLD_GB);
    }

    /** Copy with every out-of-range value replaced by its default. */
    public RetentionPolicy normalize() {
        return new RetentionPolicy(
                enabled,
                maxAgeDays >= 1 ? maxAgeDays : DEFAULT_MAX_AGE_DAYS,
                minKeepBatches >= 1 ? minKeepBatches : DEFAULT_MIN_KEEP_BATCHES,
                sizeThresholdGB >= 1 ? sizeThresholdGB : DEFAULT_SIZE_THRESHOLD_GB);
    }

    public long thresholdBytes() {
        return sizeThresholdGB * GIB;
    }
}
