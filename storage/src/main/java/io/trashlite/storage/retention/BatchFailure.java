package io.trashlite.storage.retention;

import io.trashlite.core.ErrorKind;

/**
 * A candidate batch that maintenance could not delete.
 *
 * @param invalidReason set when the batch was refused before any deletion was attempted
 */
public record BatchFailure(String batchId, String message, ErrorKind kind, String invalidReason) {
    public static final String INCONSISTENT_BATCH_ROOTS = "inconsistent_batch_roots";
    public static final String BATCH_OUTSIDE_RECYCLE_ROOT = "batch_outside_recycle_root";
}
