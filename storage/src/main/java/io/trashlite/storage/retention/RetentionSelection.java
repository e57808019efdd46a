package io.trashlite.storage.retention;

import io.trashlite.core.Batch;

import java.util.List;

/**
 * Output of {@link RetentionSelector#select}.
 * <p>
 * {@code candidates} are newest-first; {@code estimatedAfterBytes} is what the indexed
 * total would be once every candidate is gone (never below 0).
 */
public record RetentionSelection(
        List<Batch> keepRecent,
        List<SelectedBatch> candidates,
        long totalBytes,
        long thresholdBytes,
        long estimatedAfterBytes
) {
    public RetentionSelection {
        keepRecent = List.copyOf(keepRecent);
        candidates = List.copyOf(candidates);
    }

    public boolean overThreshold() {
        return totalBytes > thresholdBytes;
    }

    public int selectedByAge() {
        return count(SelectionReason.AGE);
    }

    public int selectedBySize() {
        return count(SelectionReason.SIZE);
    }

    private int count(SelectionReason reason) {
        int n = 0;
        for (SelectedBatch c : candidates) {
            if (c.reason() == reason) n++;
        }
        return n;
    }
}
