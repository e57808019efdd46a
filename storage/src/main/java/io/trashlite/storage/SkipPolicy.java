package io.trashlite.storage;

import io.trashlite.core.CleanupTarget;
import io.trashlite.core.ItemStatus;

import java.util.Optional;

/**
 * Per-target veto consulted before anything else in a cleanup run.
 * <p>
 * Returning a status records that status for the target and moves on; returning
 * empty lets the target continue through the normal checks.
 */
@FunctionalInterface
public interface SkipPolicy {
    SkipPolicy NONE = target -> Optional.empty();

    Optional<ItemStatus> evaluate(CleanupTarget target);
}
