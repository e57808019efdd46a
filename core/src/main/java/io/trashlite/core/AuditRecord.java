// file: src/main/java/io/trashlite/core/AuditRecord.java
package io.trashlite.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fact about one attempted mutation, one line of the audit log.
 * <p>
 * Core fields are fixed; everything else a caller wants carried through for reporting
 * (account, category, month, tier, maintenance counters, ...) lives in {@code metadata}
 * and is serialized next to the core fields.
 * <p>
 * Invariants:
 *  - Never edited or removed once appended; the log is the only durable truth.
 *  - {@code status} is the raw wire value so statuses written by other versions survive
 *    a read. Use {@link #hasStatus(ItemStatus)} to compare against known values.
 *  - {@code time} is epoch millis; 0 means the writer did not supply one.
 */
public record AuditRecord(
        AuditAction action,
        long time,
        String scope,
        String batchId,
        String sourcePath,
        String recyclePath,
        String restoredPath,
        String status,
        String error,
        String errorType,
        String invalidReason,
        String risk,
        long sizeBytes,
        boolean dryRun,
        Map<String, Object> metadata
) {
    public AuditRecord {
        Objects.requireNonNull(action, "action");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasStatus(ItemStatus expected) {
        return expected.wire().equals(status);
    }

    public static Builder builder(AuditAction action) {
        return new Builder(action);
    }

    /** Copy of this record as a builder, for deriving a restore record from a cleanup entry. */
    public Builder toBuilder() {
        Builder b = new Builder(action);
        b.time = time;
        b.scope = scope;
        b.batchId = batchId;
        b.sourcePath = sourcePath;
        b.recyclePath = recyclePath;
        b.restoredPath = restoredPath;
        b.status = status;
        b.error = error;
        b.errorType = errorType;
        b.invalidReason = invalidReason;
        b.risk = risk;
        b.sizeBytes = sizeBytes;
        b.dryRun = dryRun;
        b.metadata.putAll(metadata);
        return b;
    }

    public static final class Builder {
        private AuditAction action;
        private long time;
        private String scope;
        private String batchId;
        private String sourcePath;
        private String recyclePath;
        private String restoredPath;
        private String status;
        private String error;
        private String errorType;
        private String invalidReason;
        private String risk;
        private long sizeBytes;
        private boolean dryRun;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(AuditAction action) {
            this.action = Objects.requireNonNull(action, "action");
        }

        public Builder action(AuditAction action) { this.action = Objects.requireNonNull(action, "action"); return this; }
        public Builder time(long time) { this.time = time; return this; }
        public Builder scope(String scope) { this.scope = scope; return this; }
        public Builder batchId(String batchId) { this.batchId = batchId; return this; }
        public Builder sourcePath(String sourcePath) { this.sourcePath = sourcePath; return this; }
        public Builder recyclePath(String recyclePath) { this.recyclePath = recyclePath; return this; }
        public Builder restoredPath(String restoredPath) { this.restoredPath = restoredPath; return this; }
        public Builder status(String status) { this.status = status; return this; }
        public Builder status(ItemStatus status) { this.status = status.wire(); return this; }
        public Builder status(MaintenanceStatus status) { this.status = status.wire(); return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder errorType(String errorType) { this.errorType = errorType; return this; }
        public Builder errorType(ErrorKind kind) { this.errorType = kind == null ? null : kind.wire(); return this; }
        public Builder invalidReason(String invalidReason) { this.invalidReason = invalidReason; return this; }
        public Builder invalidReason(InvalidPathReason reason) { this.invalidReason = reason == null ? null : reason.wire(); return this; }
        public Builder risk(String risk) { this.risk = risk; return this; }
        public Builder sizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) metadata.putAll(values);
            return this;
        }

        public Builder put(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        /** Drops the restore/cleanup outcome fields so a derived record starts clean. */
        public Builder clearOutcome() {
            restoredPath = null;
            status = null;
            error = null;
            errorType = null;
            invalidReason = null;
            risk = null;
            return this;
        }

        public AuditRecord build() {
            return new AuditRecord(action, time, scope, batchId, sourcePath, recyclePath, restoredPath,
                    status, error, errorType, invalidReason, risk, sizeBytes, dryRun, metadata);
        }
    }
}
