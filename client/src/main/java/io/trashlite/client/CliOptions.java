// file: client/src/main/java/io/trashlite/client/CliOptions.java
package io.trashlite.client;

import io.trashlite.storage.ConflictStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line flags plus the command and its positional arguments.
 *
 * Supported flags (anywhere on the line):
 *   --config,       -c   <path>   JSON config file
 *   --state-root         <path>   overrides stateRoot (and the derived recycle root / index)
 *   --profile-root       <path>   overrides profileRoot
 *   --dry-run / --no-dry-run      overrides dryRunDefault
 *   --conflict           <skip|overwrite|rename|ask>   restore conflict strategy (default: skip)
 *   --scope              <label>  scope written on cleanup records
 *   --help,         -h
 *
 * Null fields mean "not given on the command line".
 */
public record CliOptions(
        String configPath,
        String stateRoot,
        String profileRoot,
        Boolean dryRun,
        String conflict,
        String scope,
        boolean help,
        String command,
        List<String> arguments
) {
    public static final String CONFLICT_ASK = "ask";

    public CliOptions {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static CliOptions fromArgs(String[] args) {
        String configPath = null;
        String stateRoot = null;
        String profileRoot = null;
        Boolean dryRun = null;
        String conflict = null;
        String scope = null;
        boolean help = false;
        String command = null;
        List<String> rest = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--state-root" -> {
                    ensureValue(args, i);
                    stateRoot = args[++i];
                }

                case "--profile-root" -> {
                    ensureValue(args, i);
                    profileRoot = args[++i];
                }

                case "--dry-run" -> dryRun = true;
                case "--no-dry-run" -> dryRun = false;

                case "--conflict" -> {
                    ensureValue(args, i);
                    conflict = parseConflict(args[++i]);
                }

                case "--scope" -> {
                    ensureValue(args, i);
                    scope = args[++i];
                }

                default -> {
                    if (args[i].startsWith("-") && args[i].length() > 1) {
                        throw new CliException("Unknown option: " + args[i]);
                    }
                    if (command == null) {
                        command = args[i];
                    } else {
                        rest.add(args[i]);
                    }
                }
            }
        }
        return new CliOptions(configPath, stateRoot, profileRoot, dryRun, conflict, scope, help, command, rest);
    }

    private static String parseConflict(String raw) {
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (CONFLICT_ASK.equals(v)) return v;
        try {
            return ConflictStrategy.parse(v).wire();
        } catch (IllegalArgumentException e) {
            throw new CliException("Invalid --conflict: " + raw + " (expected skip, overwrite, rename or ask)");
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("Missing value for option: " + args[i]);
        }
    }

    static String usage() {
        return """
            Usage: trash-lite [options] <command> [args]

            Commands:
              batches                 List restorable batches, newest first
              stats                   Recycle bin size and batch counts
              cleanup <path>...       Move paths into the recycle bin
              restore <batchId>       Restore one batch
              maintain                Apply the retention policy
              lock                    Show who holds the state directory lock
              unlock                  Remove the lock file

            Options:
              --config,       -c   JSON config file (default: <stateRoot>/config.json if present)
              --state-root         State directory (default: ~/.trash-lite)
              --profile-root       Root every restore must land under
              --dry-run / --no-dry-run
                                   Decide and log without touching files (default from config: on)
              --conflict           skip | overwrite | rename | ask (default: skip)
              --scope              Scope label for cleanup records (default: cleanup_monthly)
              --help,         -h   Show this help message
            """;
    }
}
