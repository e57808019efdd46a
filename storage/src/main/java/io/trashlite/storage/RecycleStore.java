// file: src/main/java/io/trashlite/storage/RecycleStore.java
package io.trashlite.storage;

import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;
import io.trashlite.core.BatchIds;
import io.trashlite.core.CleanupTarget;
import io.trashlite.core.ErrorClassifier;
import io.trashlite.core.ErrorKind;
import io.trashlite.core.InvalidPathReason;
import io.trashlite.core.ItemStatus;
import io.trashlite.core.PathSafety;
import io.trashlite.core.RecycleNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cleanup executor: soft-deletes targets by moving them into a per-run batch directory.
 * <p>
 * Per target, in order:
 *  1) skip policy veto          -> record the policy's status;
 *  2) source missing            -> skipped_missing_source;
 *  3) outside every scan root   -> skipped_invalid_path (+ invalid_reason);
 *  4) dry run                   -> dry_run, filesystem untouched;
 *  5) move to {@code <recycleRoot>/<batchId>/<seq>_<name>} -> success | failed.
 * <p>
 * Steps 1-3 are identical for dry and live runs; the two only diverge at the move.
 * Each outcome is appended to the audit log before the next target starts, and an
 * item's filesystem error is recorded and counted without aborting the run. A failed
 * log append is not caught: it propagates and ends the run.
 */
public final class RecycleStore {
    private static final Logger log = Logger.getLogger(RecycleStore.class.getName());

    private final AuditLog auditLog;
    private final Path recycleRoot;
    private final PathMover mover;
    private final Clock clock;
    private final Random random;

    public RecycleStore(AuditLog auditLog, Path recycleRoot, PathMover mover, Clock clock) {
        this(auditLog, recycleRoot, mover, clock, new SecureRandom());
    }

    public RecycleStore(AuditLog auditLog, Path recycleRoot, PathMover mover, Clock clock, Random random) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.recycleRoot = Objects.requireNonNull(recycleRoot, "recycleRoot").toAbsolutePath().normalize();
        this.mover = Objects.requireNonNull(mover, "mover");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    public CleanupSummary cleanup(CleanupRequest request) {
        Objects.requireNonNull(request, "request");
        String batchId = BatchIds.generate(clock, random);
        Path batchRoot = recycleRoot.resolve(batchId);
        List<CleanupTarget> targets = request.targets();
        int total = targets.size();

        log.info(() -> String.format("Cleanup batch %s started: %d target(s), dryRun=%s, scope=%s",
                batchId, total, request.dryRun(), request.scope()));

        int success = 0, skipped = 0, failed = 0;
        long reclaimed = 0;
        List<ItemFailure> failures = new ArrayList<>();

        for (int i = 0; i < total; i++) {
            CleanupTarget target = targets.get(i);
            request.progress().onProgress(i + 1, total);

            Path source = target.path().toAbsolutePath().normalize();
            AuditRecord.Builder rec = AuditRecord.builder(AuditAction.CLEANUP)
                    .scope(request.scope())
                    .batchId(batchId)
                    .sourcePath(source.toString())
                    .sizeBytes(target.sizeBytes())
                    .dryRun(request.dryRun())
                    .metadata(target.metadata());

            Optional<ItemStatus> veto = request.skipPolicy().evaluate(target);
            if (veto.isPresent()) {
                skipped++;
                append(rec.status(veto.get()).errorType(ErrorKind.POLICY_SKIPPED));
                continue;
            }

            if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
                skipped++;
                append(rec.status(ItemStatus.SKIPPED_MISSING_SOURCE).errorType(ErrorKind.PATH_NOT_FOUND));
                continue;
            }

            Optional<InvalidPathReason> invalid = PathSafety.check(
                    request.allowedRoots(), source.toString(), InvalidPathReason.SOURCE_OUTSIDE_ALLOWED_ROOT);
            if (invalid.isPresent()) {
                skipped++;
                log.warning(() -> "Refusing to recycle " + source + ": " + invalid.get().wire());
                append(rec.status(ItemStatus.SKIPPED_INVALID_PATH)
                        .invalidReason(invalid.get())
                        .errorType(ErrorKind.PATH_VALIDATION_FAILED));
                continue;
            }

            if (request.dryRun()) {
                success++;
                reclaimed += target.sizeBytes();
                append(rec.status(ItemStatus.DRY_RUN));
                continue;
            }

            Path recyclePath = batchRoot.resolve(RecycleNames.itemName(i + 1, source));
            rec.recyclePath(recyclePath.toString());
            try {
                mover.move(source, recyclePath);
                success++;
                reclaimed += target.sizeBytes();
                append(rec.status(ItemStatus.SUCCESS));
            } catch (IOException | RuntimeException e) {
                failed++;
                String message = ErrorClassifier.describe(e);
                ErrorKind kind = ErrorClassifier.classify(e);
                failures.add(new ItemFailure(source.toString(), message, kind));
                log.log(Level.WARNING, "Failed to recycle " + source + " (" + kind.wire() + ")", e);
                append(rec.status(ItemStatus.FAILED).error(message).errorType(kind));
            }
        }

        CleanupSummary summary = new CleanupSummary(batchId, request.dryRun(), success, skipped, failed, reclaimed, failures);
        log.info(() -> String.format("Cleanup batch %s finished: success=%d skipped=%d failed=%d bytes=%d",
                batchId, summary.successCount(), summary.skippedCount(), summary.failedCount(), summary.reclaimedBytes()));
        return summary;
    }

    public Path recycleRoot() {
        return recycleRoot;
    }

    private void append(AuditRecord.Builder rec) {
        auditLog.append(rec.time(clock.millis()).build());
    }
}
