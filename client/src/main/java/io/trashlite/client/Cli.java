// file: client/src/main/java/io/trashlite/client/Cli.java
package io.trashlite.client;

import io.trashlite.core.Batch;
import io.trashlite.core.CleanupTarget;
import io.trashlite.storage.CleanupRequest;
import io.trashlite.storage.CleanupSummary;
import io.trashlite.storage.ConflictResolver;
import io.trashlite.storage.ConflictStrategy;
import io.trashlite.storage.DiskUsage;
import io.trashlite.storage.ItemFailure;
import io.trashlite.storage.RecycleBin;
import io.trashlite.storage.RestoreRequest;
import io.trashlite.storage.RestoreSummary;
import io.trashlite.storage.lock.LockHeldException;
import io.trashlite.storage.lock.LockInfo;
import io.trashlite.storage.lock.ProcessLock;
import io.trashlite.storage.retention.BatchFailure;
import io.trashlite.storage.retention.MaintenanceSummary;
import io.trashlite.storage.retention.RecycleStats;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.LogManager;

/**
 * Command-line front end over a local recycle bin.
 *
 * Usage:
 *   trash-lite [options] batches
 *   trash-lite [options] stats
 *   trash-lite [options] cleanup <path>...
 *   trash-lite [options] restore <batchId>
 *   trash-lite [options] maintain
 *   trash-lite [options] lock | unlock
 *
 * Examples:
 *   trash-lite --profile-root ~/Profiles --no-dry-run cleanup ~/Profiles/acc1/cache/2024-01
 *   trash-lite --profile-root ~/Profiles --conflict ask --no-dry-run restore 20240301-101530-a1b2c3
 *
 * Exit codes: 0 ok, 1 usage / configuration / lock problem, 2 unexpected failure.
 */
public final class Cli {

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final Path home;

    Cli(InputStream in, PrintStream out, PrintStream err, Path home) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.err = err;
        this.home = home;
    }

    public static void main(String[] args) {
        installLogging();
        int code = new Cli(System.in, System.out, System.err, Path.of(System.getProperty("user.home"))).run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        try {
            CliOptions opts = CliOptions.fromArgs(args);
            if (opts.help()) {
                out.println(CliOptions.usage());
                return 0;
            }
            if (opts.command() == null) {
                throw new CliException("missing command");
            }
            TrashConfig config = TrashConfig.load(opts, home);
            dispatch(opts, config);
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println("Run with --help for usage.");
            return 1;
        } catch (ConfigException | LockHeldException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void dispatch(CliOptions opts, TrashConfig config) {
        List<String> rest = opts.arguments();
        switch (opts.command()) {
            case "batches" -> {
                requireArgs(rest, 0, "batches takes no arguments");
                batches(new RecycleBin(config.binSettings()));
            }
            case "stats" -> {
                requireArgs(rest, 0, "stats takes no arguments");
                stats(new RecycleBin(config.binSettings()));
            }
            case "cleanup" -> {
                if (rest.isEmpty()) throw new CliException("cleanup requires at least one <path>");
                cleanup(opts, config, rest);
            }
            case "restore" -> {
                requireArgs(rest, 1, "restore requires <batchId>");
                restore(opts, config, rest.get(0));
            }
            case "maintain" -> {
                requireArgs(rest, 0, "maintain takes no arguments");
                maintain(config);
            }
            case "lock" -> {
                requireArgs(rest, 0, "lock takes no arguments");
                Optional<LockInfo> owner = ProcessLock.inspect(config.stateRoot());
                out.println(owner.map(o -> "locked: " + o.describe()).orElse("unlocked"));
            }
            case "unlock" -> {
                requireArgs(rest, 0, "unlock takes no arguments");
                boolean removed = ProcessLock.breakLock(config.stateRoot());
                out.println(removed ? "lock removed: " + ProcessLock.lockPath(config.stateRoot()) : "no lock present");
            }
            default -> throw new CliException("unknown command: " + opts.command());
        }
    }

    private void batches(RecycleBin bin) {
        List<Batch> batches = bin.listRestorableBatches();
        if (batches.isEmpty()) {
            out.println("(no restorable batches)");
            return;
        }
        for (Batch b : batches) {
            out.printf("%-24s %s  %5d item(s)  %s%n",
                    b.batchId(), Instant.ofEpochMilli(b.firstTime()), b.size(), human(b.totalBytes()));
        }
    }

    private void stats(RecycleBin bin) {
        RecycleStats s = bin.stats();
        out.println("recycle root:  " + bin.recycleRoot());
        out.println("batches:       " + s.totalBatches());
        out.println("on disk:       " + human(s.totalBytes()));
        out.println("indexed:       " + human(s.indexedBytes()));
        out.println("oldest batch:  " + (s.oldestTime() == null ? "-" : Instant.ofEpochMilli(s.oldestTime())));
    }

    private void cleanup(CliOptions opts, TrashConfig config, List<String> rawPaths) {
        List<Path> roots = config.cleanupRoots();
        if (roots.isEmpty()) {
            throw new CliException("no scan roots configured: set scanRoots or profileRoot");
        }
        List<CleanupTarget> targets = new ArrayList<>();
        for (String raw : rawPaths) {
            Path p = TrashConfig.expandHome(raw, home);
            targets.add(new CleanupTarget(p, DiskUsage.sizeOf(p)));
        }
        boolean dryRun = config.dryRunDefault();
        CleanupSummary s = new RecycleBin(config.binSettings()).cleanup(
                new CleanupRequest(targets, roots, dryRun, opts.scope(), null, null));

        out.printf("%sbatch %s: %d recycled, %d skipped, %d failed, %s%n",
                dryRun ? "[dry run] " : "", s.batchId(), s.successCount(), s.skippedCount(), s.failedCount(),
                human(s.reclaimedBytes()));
        printFailures(s.failures());
    }

    private void restore(CliOptions opts, TrashConfig config, String batchId) {
        if (config.profileRoot() == null) {
            throw new CliException("restore requires a profile root (--profile-root or profileRoot in config)");
        }
        ConflictResolver resolver = CliOptions.CONFLICT_ASK.equals(opts.conflict())
                ? new InteractiveConflictResolver(in, out)
                : ConflictResolver.always(ConflictStrategy.parse(opts.conflict() == null ? "skip" : opts.conflict()));
        boolean dryRun = config.dryRunDefault();
        RestoreRequest request = new RestoreRequest(
                config.profileRoot(),
                config.extraProfileRoots(),
                config.governanceRoot(),
                config.extraGovernanceRoots(),
                config.recycleRoot(),
                dryRun,
                resolver,
                null);

        final RestoreSummary s;
        try {
            s = new RecycleBin(config.binSettings()).restore(batchId, request);
        } catch (IllegalArgumentException e) {
            throw new CliException(e.getMessage(), e);
        }
        out.printf("%sbatch %s: %d restored, %d skipped, %d failed, %s%n",
                dryRun ? "[dry run] " : "", s.batchId(), s.successCount(), s.skipCount(), s.failCount(),
                human(s.restoredBytes()));
        printFailures(s.failures());
    }

    private void maintain(TrashConfig config) {
        boolean dryRun = config.dryRunDefault();
        MaintenanceSummary s = new RecycleBin(config.binSettings()).maintain(config.retention(), dryRun, null);
        out.printf("%s%s: %d of %d batch(es) deleted (%s), %d failed; %d by age, %d by size%n",
                dryRun ? "[dry run] " : "", s.status().wire(), s.deletedBatches(), s.before().totalBatches(),
                human(s.deletedBytes()), s.failedBatches(), s.selectedByAge(), s.selectedBySize());
        for (BatchFailure f : s.failures()) {
            out.printf("  failed %s: %s (%s)%n", f.batchId(), f.message(),
                    f.invalidReason() != null ? f.invalidReason() : f.kind().label());
        }
    }

    private void printFailures(List<ItemFailure> failures) {
        for (ItemFailure f : failures) {
            out.printf("  failed %s: %s (%s)%n", f.path(), f.message(), f.kind().label());
        }
    }

    private static void requireArgs(List<String> rest, int expected, String message) {
        if (rest.size() != expected) {
            throw new CliException(message);
        }
    }

    static String human(long bytes) {
        if (bytes < 1024) return bytes + " B";
        String[] units = {"KB", "MB", "GB", "TB"};
        double v = bytes;
        int u = -1;
        while (v >= 1024 && u < units.length - 1) {
            v /= 1024;
            u++;
        }
        return String.format(Locale.ROOT, "%.1f %s", v, units[u]);
    }

    private static void installLogging() {
        try (InputStream cfg = Cli.class.getResourceAsStream("/logging.properties")) {
            if (cfg != null) {
                LogManager.getLogManager().readConfiguration(cfg);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }
}
