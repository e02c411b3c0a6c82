package io.agentmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "agentmesh-settings.json";
    public static final String DEFAULT_BROKER_URL = "memory://local";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_DISPATCH_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_DISPATCH_POLL_INTERVAL_MS = 250L;
    public static final long DEFAULT_SUBMISSION_DEADLINE_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_PUBLISH_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_PUBLISH_BASE_BACKOFF_MS = 50L;
    public static final long DEFAULT_PUBLISH_MAX_BACKOFF_MS = 2_000L;
    public static final int DEFAULT_REDELIVERY_LIMIT = 3;
    public static final long DEFAULT_MEMORY_SWEEP_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 10_000L;
    public static final int DEFAULT_AGENT_MAX_CONCURRENCY = 4;

    private final Path rootDir;

    public MeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new MeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path memoryRoot() {
        return rootDir.resolve("memory");
    }

    public Path memoryDbFile() {
        return memoryRoot().resolve("memory.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
