// file: src/main/java/io/trashlite/storage/RestoreEngine.java
package io.trashlite.storage;

import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;
import io.trashlite.core.Batch;
import io.trashlite.core.ErrorClassifier;
import io.trashlite.core.ErrorKind;
import io.trashlite.core.InvalidPathReason;
import io.trashlite.core.ItemStatus;
import io.trashlite.core.PathSafety;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a reconstructed batch back onto the filesystem.
 * <p>
 * Per entry, in order:
 *  1) recycle item missing                       -> skipped_missing_recycle;
 *  2) recycle path outside the recycle root, or
 *     destination outside the allow-listed roots -> skipped_invalid_path (+ invalid_reason);
 *  3) destination exists -> ask the ConflictResolver (unless an earlier "apply to all"
 *     answer is in force): skip -> skipped_conflict, overwrite -> remove destination first,
 *     rename -> restore to {@code <original>.restored-<millis>}, which must pass the same
 *     root check as the original destination;
 *  4) dry run -> dry_run with the would-be restoredPath;
 *  5) move the recycle item back (same rename / copy fallback as cleanup) -> success | failed.
 * <p>
 * Safety (2) always runs before conflict resolution (3), so a rejected path is never
 * offered to the resolver and never overwritten.
 * <p>
 * Root selection: entries whose scope is {@value RestoreRequest#GOVERNANCE_SCOPE} are checked
 * against the governance roots (falling back to the profile root when no governance root is
 * known) and rejected with source_outside_allowed_root; all other entries are checked
 * against the profile roots and rejected with source_outside_profile_root.
 * <p>
 * The engine keeps no state between calls; the apply-to-all memo is threaded through the
 * loop as an argument and result of {@link #restoreEntry}.
 */
public final class RestoreEngine {
    private static final Logger log = Logger.getLogger(RestoreEngine.class.getName());

    static final String RISK_OUT_OF_PROFILE_ROOT = "out_of_profile_root";

    private final AuditLog auditLog;
    private final PathMover mover;
    private final Clock clock;

    public RestoreEngine(AuditLog auditLog, PathMover mover, Clock clock) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.mover = Objects.requireNonNull(mover, "mover");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RestoreSummary restore(Batch batch, RestoreRequest request) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(request, "request");

        List<AuditRecord> entries = batch.entries();
        int total = entries.size();
        log.info(() -> String.format("Restore of batch %s started: %d entr%s, dryRun=%s",
                batch.batchId(), total, total == 1 ? "y" : "ies", request.dryRun()));

        int success = 0, skipped = 0, failed = 0;
        long restoredBytes = 0;
        List<ItemFailure> failures = new ArrayList<>();
        ConflictStrategy applyToAll = null;

        for (int i = 0; i < total; i++) {
            request.progress().onProgress(i + 1, total);
            Outcome outcome = restoreEntry(batch.batchId(), entries.get(i), request, applyToAll);
            applyToAll = outcome.applyToAll();
            auditLog.append(outcome.record());

            switch (outcome.kind()) {
                case SUCCESS -> {
                    success++;
                    restoredBytes += outcome.record().sizeBytes();
                }
                case SKIPPED -> skipped++;
                case FAILED -> {
                    failed++;
                    failures.add(outcome.failure());
                }
            }
        }

        RestoreSummary summary = new RestoreSummary(batch.batchId(), request.dryRun(),
                success, skipped, failed, restoredBytes, failures);
        log.info(() -> String.format("Restore of batch %s finished: success=%d skipped=%d failed=%d bytes=%d",
                summary.batchId(), summary.successCount(), summary.skipCount(), summary.failCount(), summary.restoredBytes()));
        return summary;
    }

    private Outcome restoreEntry(String batchId, AuditRecord entry, RestoreRequest req, ConflictStrategy applyToAll) {
        AuditRecord.Builder rec = entry.toBuilder()
                .action(AuditAction.RESTORE)
                .batchId(batchId)
                .clearOutcome()
                .dryRun(req.dryRun());

        Path recycle = PathSafety.parse(entry.recyclePath());
        if (recycle == null || !Files.exists(recycle, LinkOption.NOFOLLOW_LINKS)) {
            return skipped(rec.status(ItemStatus.SKIPPED_MISSING_RECYCLE).errorType(ErrorKind.PATH_NOT_FOUND), applyToAll);
        }

        if (req.recycleRoot() != null && !PathSafety.isAllowed(req.recycleRoot(), recycle)) {
            return invalid(rec, InvalidPathReason.RECYCLE_OUTSIDE_RECYCLE_ROOT, entry, applyToAll);
        }

        boolean governance = RestoreRequest.GOVERNANCE_SCOPE.equals(entry.scope());
        List<Path> roots = allowedRoots(req, governance);
        InvalidPathReason outsideReason = governance
                ? InvalidPathReason.SOURCE_OUTSIDE_ALLOWED_ROOT
                : InvalidPathReason.SOURCE_OUTSIDE_PROFILE_ROOT;
        Optional<InvalidPathReason> rejected = PathSafety.check(roots, entry.sourcePath(), outsideReason);
        if (rejected.isPresent()) {
            return invalid(rec, rejected.get(), entry, applyToAll);
        }

        Path original = Path.of(entry.sourcePath()).toAbsolutePath().normalize();
        if (governance && !PathSafety.isAllowed(req.profileRoot(), original)) {
            rec.risk(RISK_OUT_OF_PROFILE_ROOT);
        }

        Path target = original;
        ConflictStrategy strategy = null;
        if (Files.exists(original, LinkOption.NOFOLLOW_LINKS)) {
            strategy = applyToAll;
            if (strategy == null) {
                ConflictResolver.Decision decision = req.conflictResolver()
                        .resolve(new ConflictResolver.Conflict(original, recycle, entry));
                strategy = decision == null ? ConflictStrategy.SKIP : decision.strategy();
                if (decision != null && decision.applyToAll()) {
                    applyToAll = strategy;
                }
            }
            if (strategy == ConflictStrategy.SKIP) {
                return skipped(rec.status(ItemStatus.SKIPPED_CONFLICT).errorType(ErrorKind.CONFLICT), applyToAll);
            }
            if (strategy == ConflictStrategy.RENAME) {
                target = renameTarget(original);
                if (!PathSafety.isAllowedAny(roots, target)) {
                    return invalid(rec, outsideReason, entry, applyToAll);
                }
            }
        }

        rec.restoredPath(target.toString());
        if (req.dryRun()) {
            return new Outcome(OutcomeKind.SUCCESS, stamp(rec.status(ItemStatus.DRY_RUN)), null, applyToAll);
        }

        try {
            if (strategy == ConflictStrategy.OVERWRITE) {
                mover.deleteRecursively(original);
            }
            mover.move(recycle, target);
            return new Outcome(OutcomeKind.SUCCESS, stamp(rec.status(ItemStatus.SUCCESS)), null, applyToAll);
        } catch (IOException | RuntimeException e) {
            String message = ErrorClassifier.describe(e);
            ErrorKind kind = ErrorClassifier.classify(e);
            log.log(Level.WARNING, "Failed to restore " + recycle + " -> " + target + " (" + kind.wire() + ")", e);
            AuditRecord failed = stamp(rec.restoredPath(null).status(ItemStatus.FAILED).error(message).errorType(kind));
            return new Outcome(OutcomeKind.FAILED, failed, new ItemFailure(original.toString(), message, kind), applyToAll);
        }
    }

    private static List<Path> allowedRoots(RestoreRequest req, boolean governance) {
        List<Path> roots = new ArrayList<>();
        if (governance) {
            roots.add(req.governanceRoot() != null ? req.governanceRoot() : req.profileRoot());
            roots.addAll(req.extraGovernanceRoots());
        } else {
            roots.add(req.profileRoot());
            roots.addAll(req.extraProfileRoots());
        }
        return roots;
    }

    private Path renameTarget(Path original) {
        return original.resolveSibling(original.getFileName() + ".restored-" + clock.millis());
    }

    private Outcome invalid(AuditRecord.Builder rec, InvalidPathReason reason, AuditRecord entry, ConflictStrategy applyToAll) {
        log.warning(() -> "Refusing to restore " + entry.recyclePath() + " -> " + entry.sourcePath() + ": " + reason.wire());
        return skipped(rec.status(ItemStatus.SKIPPED_INVALID_PATH)
                .invalidReason(reason)
                .errorType(ErrorKind.PATH_VALIDATION_FAILED), applyToAll);
    }

    private Outcome skipped(AuditRecord.Builder rec, ConflictStrategy applyToAll) {
        return new Outcome(OutcomeKind.SKIPPED, stamp(rec), null, applyToAll);
    }

    private AuditRecord stamp(AuditRecord.Builder rec) {
        return rec.time(clock.millis()).build();
    }

    private enum OutcomeKind { SUCCESS, SKIPPED, FAILED }

    /** Result of one entry plus the apply-to-all strategy to carry into the next one. */
    private record Outcome(OutcomeKind kind, AuditRecord record, ItemFailure failure, ConflictStrategy applyToAll) {}
}
