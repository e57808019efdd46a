package io.trashlite.storage.retention;

import io.trashlite.core.Batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Pure batch selection; touches neither disk nor log.
 * <p>
 * Procedure, over batches sorted newest-first:
 *  1) the newest {@code minKeepBatches} are protected;
 *  2) any other batch at least {@code maxAgeDays} whole days old is selected by AGE;
 *  3) while the bytes left after step 2 exceed the threshold, the oldest remaining
 *     unprotected batch is selected by SIZE.
 * <p>
 * Step 3 is a greedy backstop: it may remove more than strictly needed when one old
 * batch is large, and it never touches protected batches even if the bin stays over.
 */
public final class RetentionSelector {
    private static final Comparator<Batch> NEWEST_FIRST = Comparator
            .comparingLong(Batch::firstTime).reversed()
            .thenComparing(Batch::batchId, Comparator.reverseOrder());

    private RetentionSelector() {
        // utility
    }

    public static RetentionSelection select(List<Batch> batches, RetentionPolicy policy, long nowMillis) {
        RetentionPolicy p = policy.normalize();
        List<Batch> sorted = new ArrayList<>(batches);
        sorted.sort(NEWEST_FIRST);

        int keep = Math.min(p.minKeepBatches(), sorted.size());
        List<Batch> keepRecent = sorted.subList(0, keep);
        List<Batch> rest = sorted.subList(keep, sorted.size());

        long total = 0;
        for (Batch b : sorted) total += b.totalBytes();
        long threshold = p.thresholdBytes();

        // batchId -> selection, kept in newest-first order at the end
        Map<String, SelectionReason> chosen = new LinkedHashMap<>();
        long remaining = total;
        for (Batch b : rest) {
            if (ageDays(b, nowMillis) >= p.maxAgeDays()) {
                chosen.put(b.batchId(), SelectionReason.AGE);
                remaining -= b.totalBytes();
            }
        }

        for (int i = rest.size() - 1; i >= 0 && remaining > threshold; i--) {
            Batch b = rest.get(i);
            if (chosen.containsKey(b.batchId())) continue;
            chosen.put(b.batchId(), SelectionReason.SIZE);
            remaining -= b.totalBytes();
        }

        List<SelectedBatch> candidates = new ArrayList<>(chosen.size());
        for (Batch b : rest) {
            SelectionReason reason = chosen.get(b.batchId());
            if (reason != null) candidates.add(new SelectedBatch(b, reason));
        }
        return new RetentionSelection(keepRecent, candidates, total, threshold, Math.max(0L, remaining));
    }

    static long ageDays(Batch b, long nowMillis) {
        return TimeUnit.MILLISECONDS.toDays(Math.max(0L, nowMillis - b.firstTime()));
    }
}
