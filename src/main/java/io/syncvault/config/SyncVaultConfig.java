package io.syncvault.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Filesystem layout of one vault. Everything a vault persists (SQLite state, settings, saved
 * profiles, the audit chain and exported reports) lives under {@link #rootDir()}; non-default
 * namespaces are nested below {@code <base>/namespaces/<name>} so several tenants can share a
 * data root.
 */
public record SyncVaultConfig(Path rootDir, Path rootBaseDir, String namespace) {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String NAMESPACES_DIR = "namespaces";
    public static final int DEFAULT_DESTINATION_PARALLELISM = 4;
    public static final int DEFAULT_PARITY_BLOCK_COUNT = 16;
    public static final int MAX_PARITY_BLOCK_COUNT = 4_096;

    private static final Pattern UNSAFE_RUN = Pattern.compile("[^a-z0-9_.-]+");
    private static final Pattern DASH_RUN = Pattern.compile("-{2,}");

    public static SyncVaultConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static SyncVaultConfig fromRoot(String root, String namespace) {
        Path base = (root == null || root.isBlank() ? Paths.get("syncvault-data") : Paths.get(root))
                .toAbsolutePath()
                .normalize();
        String ns = sanitizeNamespace(namespace);
        if (DEFAULT_NAMESPACE.equals(ns)) {
            return new SyncVaultConfig(base, base, ns);
        }
        return new SyncVaultConfig(base.resolve(NAMESPACES_DIR).resolve(ns), base, ns);
    }

    /**
     * Lower-cases the name and folds every run of characters outside {@code [a-z0-9_.-]} into a
     * single dash. Names that end up empty map to the default namespace.
     */
    static String sanitizeNamespace(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        String folded = UNSAFE_RUN.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        folded = DASH_RUN.matcher(folded).replaceAll("-");
        if (folded.isEmpty() || folded.equals("-")) {
            return DEFAULT_NAMESPACE;
        }
        // keep namespaces from resolving to hidden or parent directories
        return folded.startsWith(".") ? "ns" + folded : folded;
    }

    public Path dbFile() {
        return rootDir.resolve("syncvault.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("syncvault-settings.json");
    }

    public Path profilesRoot() {
        return rootDir.resolve("profiles");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }
}
