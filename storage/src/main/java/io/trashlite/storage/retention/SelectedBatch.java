package io.trashlite.storage.retention;

import io.trashlite.core.Batch;

import java.util.Objects;

/** A batch chosen for permanent deletion, and why. */
public record SelectedBatch(Batch batch, SelectionReason reason) {
    public SelectedBatch {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(reason, "reason");
    }
}
