package io.trashlite.storage;

import io.trashlite.core.CleanupTarget;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one cleanup run.
 *
 * @param targets      items to recycle, processed in list order
 * @param allowedRoots scan roots every source must resolve under
 * @param dryRun       decide and log everything, move nothing
 * @param scope        free-form run label written to every record (e.g. "cleanup_monthly")
 * @param skipPolicy   optional per-target veto
 * @param progress     optional progress hook
 */
public record CleanupRequest(
        List<CleanupTarget> targets,
        List<Path> allowedRoots,
        boolean dryRun,
        String scope,
        SkipPolicy skipPolicy,
        ProgressListener progress
) {
    public static final String DEFAULT_SCOPE = "cleanup_monthly";

    public CleanupRequest {
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        allowedRoots = List.copyOf(Objects.requireNonNull(allowedRoots, "allowedRoots"));
        scope = scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope;
        skipPolicy = skipPolicy == null ? SkipPolicy.NONE : skipPolicy;
        progress = progress == null ? ProgressListener.NONE : progress;
    }

    public CleanupRequest(List<CleanupTarget> targets, List<Path> allowedRoots, boolean dryRun) {
        this(targets, allowedRoots, dryRun, DEFAULT_SCOPE, null, null);
    }
}
