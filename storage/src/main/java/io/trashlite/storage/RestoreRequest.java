package io.trashlite.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one restore run.
 *
 * @param profileRoot          root every ordinary entry must restore under
 * @param extraProfileRoots    additional roots accepted for ordinary entries
 * @param governanceRoot       data root for whole-system ("space_governance") batches, nullable
 * @param extraGovernanceRoots additional roots accepted for governance entries
 * @param recycleRoot          when set, recycle paths from the log must live under it
 * @param dryRun               decide and log everything, move nothing
 * @param conflictResolver     decides what to do when the destination exists
 * @param progress             optional progress hook
 */
public record RestoreRequest(
        Path profileRoot,
        List<Path> extraProfileRoots,
        Path governanceRoot,
        List<Path> extraGovernanceRoots,
        Path recycleRoot,
        boolean dryRun,
        ConflictResolver conflictResolver,
        ProgressListener progress
) {
    public static final String GOVERNANCE_SCOPE = "space_governance";

    public RestoreRequest {
        Objects.requireNonNull(profileRoot, "profileRoot");
        extraProfileRoots = extraProfileRoots == null ? List.of() : List.copyOf(extraProfileRoots);
        extraGovernanceRoots = extraGovernanceRoots == null ? List.of() : List.copyOf(extraGovernanceRoots);
        conflictResolver = conflictResolver == null ? ConflictResolver.always(ConflictStrategy.SKIP) : conflictResolver;
        progress = progress == null ? ProgressListener.NONE : progress;
    }

    public RestoreRequest(Path profileRoot, ConflictResolver conflictResolver) {
        this(profileRoot, List.of(), null, List.of(), null, false, conflictResolver, null);
    }

    public RestoreRequest withDryRun(boolean dry) {
        return new RestoreRequest(profileRoot, extraProfileRoots, governanceRoot, extraGovernanceRoots,
                recycleRoot, dry, conflictResolver, progress);
    }

    public RestoreRequest withRecycleRoot(Path root) {
        return new RestoreRequest(profileRoot, extraProfileRoots, governanceRoot, extraGovernanceRoots,
                root, dryRun, conflictResolver, progress);
    }

    public RestoreRequest withConflictResolver(ConflictResolver resolver) {
        return new RestoreRequest(profileRoot, extraProfileRoots, governanceRoot, extraGovernanceRoots,
                recycleRoot, dryRun, resolver, progress);
    }
}
