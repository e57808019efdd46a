package io.trashlite.storage;

import io.trashlite.core.AuditRecord;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Policy for a restore whose destination already exists.
 * <p>
 * Called synchronously from the restore loop, once per conflicting entry, until a
 * decision flagged {@code applyToAll} fixes the strategy for the rest of that run.
 */
@FunctionalInterface
public interface ConflictResolver {

    Decision resolve(Conflict conflict);

    /**
     * @param originalPath destination that already exists
     * @param recyclePath  recycled content waiting to be restored
     * @param entry        the cleanup record being replayed
     */
    record Conflict(Path originalPath, Path recyclePath, AuditRecord entry) {}

    /**
     * @param strategy   how to handle this entry
     * @param applyToAll reuse the strategy for every later conflict in the same run
     */
    record Decision(ConflictStrategy strategy, boolean applyToAll) {
        public Decision {
            Objects.requireNonNull(strategy, "strategy");
        }
    }

    /** Resolver that always answers with the same strategy. */
    static ConflictResolver always(ConflictStrategy strategy) {
        Decision d = new Decision(strategy, true);
        return conflict -> d;
    }
}
