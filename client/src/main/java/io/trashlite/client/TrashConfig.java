// file: client/src/main/java/io/trashlite/client/TrashConfig.java
package io.trashlite.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trashlite.client.dto.JsonTrashConfig;
import io.trashlite.storage.RecycleBinSettings;
import io.trashlite.storage.retention.RetentionPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolved configuration: JSON file values, then command-line overrides, then defaults.
 * <p>
 * Defaults:
 *  - stateRoot:   ~/.trash-lite
 *  - recycleRoot: <stateRoot>/recycle-bin
 *  - indexPath:   <stateRoot>/index.jsonl
 *  - dryRunDefault: true
 *  - recycleRetention: enabled, 30 days, keep 20 batches, 20 GB
 * <p>
 * A leading "~" in any path expands to the user's home directory; relative paths resolve
 * against the working directory.
 */
public final class TrashConfig {
    public static final String DEFAULT_STATE_DIR = ".trash-lite";
    public static final String DEFAULT_CONFIG_FILE = "config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path stateRoot;
    private final Path recycleRoot;
    private final Path indexPath;
    private final Path profileRoot;
    private final List<Path> extraProfileRoots;
    private final Path governanceRoot;
    private final List<Path> extraGovernanceRoots;
    private final List<Path> scanRoots;
    private final boolean dryRunDefault;
    private final RetentionPolicy retention;

    public TrashConfig(
            Path stateRoot,
            Path recycleRoot,
            Path indexPath,
            Path profileRoot,
            List<Path> extraProfileRoots,
            Path governanceRoot,
            List<Path> extraGovernanceRoots,
            List<Path> scanRoots,
            boolean dryRunDefault,
            RetentionPolicy retention
    ) {
        this.stateRoot = Objects.requireNonNull(stateRoot, "stateRoot");
        this.recycleRoot = recycleRoot != null ? recycleRoot : stateRoot.resolve(RecycleBinSettings.DEFAULT_RECYCLE_DIR);
        this.indexPath = indexPath != null ? indexPath : stateRoot.resolve(RecycleBinSettings.DEFAULT_INDEX_FILE);
        this.profileRoot = profileRoot;
        this.extraProfileRoots = List.copyOf(extraProfileRoots);
        this.governanceRoot = governanceRoot;
        this.extraGovernanceRoots = List.copyOf(extraGovernanceRoots);
        this.scanRoots = List.copyOf(scanRoots);
        this.dryRunDefault = dryRunDefault;
        this.retention = Objects.requireNonNull(retention, "retention").normalize();
        if (this.recycleRoot.equals(this.stateRoot)) {
            throw new ConfigException("recycleRoot must not be the state root itself: " + this.recycleRoot);
        }
    }

    public static TrashConfig defaults(Path home) {
        return fromJson(new JsonTrashConfig(), null, home);
    }

    /**
     * Load the config for one invocation.
     * <p>
     * Lookup: {@code --config} when given (must exist), else {@code <stateRoot>/config.json}
     * when present, else built-in defaults. CLI flags win over file values.
     */
    public static TrashConfig load(CliOptions opts, Path home) {
        JsonTrashConfig json;
        if (opts.configPath() != null) {
            json = readJson(expandHome(opts.configPath(), home));
        } else {
            String rawState = opts.stateRoot() != null ? opts.stateRoot() : "~/" + DEFAULT_STATE_DIR;
            Path candidate = expandHome(rawState, home).resolve(DEFAULT_CONFIG_FILE);
            json = Files.isRegularFile(candidate) ? readJson(candidate) : new JsonTrashConfig();
        }
        return fromJson(json, opts, home);
    }

    public static TrashConfig fromJsonFile(Path path, Path home) {
        return fromJson(readJson(path), null, home);
    }

    static JsonTrashConfig readJson(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        try {
            JsonTrashConfig cfg = MAPPER.readValue(path.toFile(), JsonTrashConfig.class);
            if (cfg == null) throw new ConfigException("Config file is empty: " + path);
            return cfg;
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid config file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path, e);
        }
    }

    private static TrashConfig fromJson(JsonTrashConfig cfg, CliOptions opts, Path home) {
        String rawState = firstNonBlank(opts == null ? null : opts.stateRoot(), cfg.stateRoot, "~/" + DEFAULT_STATE_DIR);
        String rawProfile = firstNonBlank(opts == null ? null : opts.profileRoot(), cfg.profileRoot, null);

        Path stateRoot = expandHome(rawState, home);
        Path recycleRoot = optionalPath(cfg.recycleRoot, home);
        Path indexPath = optionalPath(cfg.indexPath, home);

        boolean dryRunDefault = cfg.dryRunDefault == null || cfg.dryRunDefault;
        if (opts != null && opts.dryRun() != null) dryRunDefault = opts.dryRun();

        return new TrashConfig(
                stateRoot,
                recycleRoot,
                indexPath,
                optionalPath(rawProfile, home),
                paths(cfg.extraProfileRoots, home),
                optionalPath(cfg.governanceRoot, home),
                paths(cfg.extraGovernanceRoots, home),
                paths(cfg.scanRoots, home),
                dryRunDefault,
                retention(cfg.recycleRetention)
        );
    }

    private static RetentionPolicy retention(JsonTrashConfig.JsonRetention r) {
        RetentionPolicy d = RetentionPolicy.defaults();
        if (r == null) return d;
        return new RetentionPolicy(
                r.enabled == null ? d.enabled() : r.enabled,
                r.maxAgeDays == null ? d.maxAgeDays() : r.maxAgeDays,
                r.minKeepBatches == null ? d.minKeepBatches() : r.minKeepBatches,
                r.sizeThresholdGB == null ? d.sizeThresholdGB() : r.sizeThresholdGB
        ).normalize();
    }

    static Path expandHome(String raw, Path home) {
        String v = raw.trim();
        try {
            Path p;
            if (v.equals("~")) {
                p = home;
            } else if (v.startsWith("~/") || v.startsWith("~\\")) {
                p = home.resolve(v.substring(2));
            } else {
                p = Path.of(v);
            }
            return p.toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path in configuration: " + raw, e);
        }
    }

    private static Path optionalPath(String raw, Path home) {
        return raw == null || raw.isBlank() ? null : expandHome(raw, home);
    }

    private static List<Path> paths(List<String> raw, Path home) {
        List<Path> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s != null && !s.isBlank()) out.add(expandHome(s, home));
        }
        return out;
    }

    private static String firstNonBlank(String a, String b, String fallback) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return fallback;
    }

    public RecycleBinSettings binSettings() {
        return new RecycleBinSettings(stateRoot, recycleRoot, indexPath);
    }

    /** Roots a cleanup source must sit under: scanRoots, else the profile root, else none. */
    public List<Path> cleanupRoots() {
        if (!scanRoots.isEmpty()) return scanRoots;
        return profileRoot == null ? List.of() : List.of(profileRoot);
    }

    public Path stateRoot() {
        return stateRoot;
    }

    public Path recycleRoot() {
        return recycleRoot;
    }

    public Path indexPath() {
        return indexPath;
    }

    /** Nullable: restore needs it, cleanup can run off scanRoots alone. */
    public Path profileRoot() {
        return profileRoot;
    }

    public List<Path> extraProfileRoots() {
        return extraProfileRoots;
    }

    public Path governanceRoot() {
        return governanceRoot;
    }

    public List<Path> extraGovernanceRoots() {
        return extraGovernanceRoots;
    }

    public List<Path> scanRoots() {
        return scanRoots;
    }

    public boolean dryRunDefault() {
        return dryRunDefault;
    }

    public RetentionPolicy retention() {
        return retention;
    }
}
