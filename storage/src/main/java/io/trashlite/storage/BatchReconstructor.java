// file: src/main/java/io/trashlite/storage/BatchReconstructor.java
package io.trashlite.storage;

import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;
import io.trashlite.core.Batch;
import io.trashlite.core.ItemStatus;
import io.trashlite.core.PathSafety;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Replays the audit log into "what can still be restored right now".
 * <p>
 * Procedure (on every call, no caching):
 *  1) collect recyclePaths that have a restore record with status "success";
 *  2) keep cleanup records that carry a recyclePath not in that set;
 *  3) drop survivors whose recycle path no longer exists on disk (orphans are silent);
 *  4) group by batchId, tracking the earliest timestamp and the summed declared size;
 *  5) order batches newest-first.
 * <p>
 * Step 1 runs over the whole log before step 2, so a restore record is honoured
 * wherever it sits relative to its cleanup record.
 */
public final class BatchReconstructor {
    static final String UNKNOWN_BATCH = "unknown";

    private static final Comparator<Batch> NEWEST_FIRST = Comparator
            .comparingLong(Batch::firstTime).reversed()
            .thenComparing(Batch::batchId, Comparator.reverseOrder());

    private final AuditLog auditLog;
    private final Clock clock;

    public BatchReconstructor(AuditLog auditLog, Clock clock) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<Batch> listRestorableBatches() {
        List<AuditRecord> rows = auditLog.readAll();

        Set<String> restored = new HashSet<>();
        for (AuditRecord r : rows) {
            if (r.action() == AuditAction.RESTORE && r.hasStatus(ItemStatus.SUCCESS) && r.recyclePath() != null) {
                restored.add(r.recyclePath());
            }
        }

        long now = clock.millis();
        Map<String, Accumulator> byBatch = new LinkedHashMap<>();
        for (AuditRecord r : rows) {
            if (r.action() != AuditAction.CLEANUP || r.recyclePath() == null) continue;
            if (restored.contains(r.recyclePath())) continue;
            if (!recycleItemExists(r.recyclePath())) continue;

            String batchId = r.batchId() == null || r.batchId().isBlank() ? UNKNOWN_BATCH : r.batchId();
            long time = r.time() > 0 ? r.time() : now;
            byBatch.computeIfAbsent(batchId, id -> new Accumulator(id, time)).add(r, time);
        }

        List<Batch> out = new ArrayList<>(byBatch.size());
        for (Accumulator acc : byBatch.values()) {
            out.add(acc.toBatch());
        }
        out.sort(NEWEST_FIRST);
        return out;
    }

    public Optional<Batch> findBatch(String batchId) {
        if (batchId == null) return Optional.empty();
        return listRestorableBatches().stream()
                .filter(b -> b.batchId().equals(batchId))
                .findFirst();
    }

    private static boolean recycleItemExists(String recyclePath) {
        Path p = PathSafety.parse(recyclePath);
        return p != null && Files.exists(p, LinkOption.NOFOLLOW_LINKS);
    }

    private static final class Accumulator {
        private final String batchId;
        private long firstTime;
        private long totalBytes;
        private final List<AuditRecord> entries = new ArrayList<>();

        Accumulator(String batchId, long firstTime) {
            this.batchId = batchId;
            this.firstTime = firstTime;
        }

        void add(AuditRecord r, long time) {
            firstTime = Math.min(firstTime, time);
            totalBytes += r.sizeBytes();
            entries.add(r);
        }

        Batch toBatch() {
            return new Batch(batchId, firstTime, entries, totalBytes);
        }
    }
}
