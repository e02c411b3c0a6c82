package io.agentmesh.config;

import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolved node settings. Sources, lowest precedence first: built-in defaults,
 * {@code agentmesh-settings.json} under the root, then {@code AGENTMESH_*}
 * environment variables.
 */
public record MeshSettings(
        String brokerUrl,
        String memoryPath,
        long heartbeatIntervalMs,
        int dispatchMaxAttempts,
        long requestTimeoutMs,
        long dispatchBaseBackoffMs,
        long dispatchMaxBackoffMs,
        long dispatchPollIntervalMs,
        long submissionDeadlineMs,
        int publishMaxAttempts,
        long publishBaseBackoffMs,
        long publishMaxBackoffMs,
        int redeliveryLimit,
        long memorySweepIntervalMs,
        long shutdownGraceMs,
        int agentMaxConcurrency
) {
    public static final String ENV_BROKER_URL = "AGENTMESH_BROKER_URL";
    public static final String ENV_MEMORY_PATH = "AGENTMESH_MEMORY_PATH";
    public static final String ENV_HEARTBEAT_INTERVAL_MS = "AGENTMESH_HEARTBEAT_INTERVAL_MS";
    public static final String ENV_DISPATCH_MAX_ATTEMPTS = "AGENTMESH_DISPATCH_MAX_ATTEMPTS";
    public static final String ENV_REQUEST_TIMEOUT_MS = "AGENTMESH_REQUEST_TIMEOUT_MS";

    public static MeshSettings defaults() {
        return new MeshSettings(
                MeshConfig.DEFAULT_BROKER_URL,
                null,
                MeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                MeshConfig.DEFAULT_DISPATCH_MAX_ATTEMPTS,
                MeshConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                MeshConfig.DEFAULT_BASE_BACKOFF_MS,
                MeshConfig.DEFAULT_MAX_BACKOFF_MS,
                MeshConfig.DEFAULT_DISPATCH_POLL_INTERVAL_MS,
                MeshConfig.DEFAULT_SUBMISSION_DEADLINE_MS,
                MeshConfig.DEFAULT_PUBLISH_MAX_ATTEMPTS,
                MeshConfig.DEFAULT_PUBLISH_BASE_BACKOFF_MS,
                MeshConfig.DEFAULT_PUBLISH_MAX_BACKOFF_MS,
                MeshConfig.DEFAULT_REDELIVERY_LIMIT,
                MeshConfig.DEFAULT_MEMORY_SWEEP_INTERVAL_MS,
                MeshConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                MeshConfig.DEFAULT_AGENT_MAX_CONCURRENCY
        );
    }

    public static MeshSettings load(MeshConfig config) {
        return load(config, System.getenv());
    }

    public static MeshSettings load(MeshConfig config, Map<String, String> env) {
        MeshSettings fromFile = fromFile(readFile(config.settingsFile()), defaults());
        return fromFile.withEnvironment(env);
    }

    static SettingsFile readFile(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    static MeshSettings fromFile(SettingsFile file, MeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long publishBase = sanitizeLong(file.publishBaseBackoffMs(), defaults.publishBaseBackoffMs(), 1L);
        long dispatchBase = sanitizeLong(file.dispatchBaseBackoffMs(), defaults.dispatchBaseBackoffMs(), 1L);
        return new MeshSettings(
                sanitizeText(file.brokerUrl(), defaults.brokerUrl()),
                sanitizeText(file.memoryPath(), defaults.memoryPath()),
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L),
                sanitizeInt(file.dispatchMaxAttempts(), defaults.dispatchMaxAttempts(), 1),
                sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 10L),
                dispatchBase,
                sanitizeLong(file.dispatchMaxBackoffMs(), defaults.dispatchMaxBackoffMs(), dispatchBase),
                sanitizeLong(file.dispatchPollIntervalMs(), defaults.dispatchPollIntervalMs(), 5L),
                sanitizeLong(file.submissionDeadlineMs(), defaults.submissionDeadlineMs(), 10L),
                sanitizeInt(file.publishMaxAttempts(), defaults.publishMaxAttempts(), 1),
                publishBase,
                sanitizeLong(file.publishMaxBackoffMs(), defaults.publishMaxBackoffMs(), publishBase),
                sanitizeInt(file.redeliveryLimit(), defaults.redeliveryLimit(), 0),
                sanitizeLong(file.memorySweepIntervalMs(), defaults.memorySweepIntervalMs(), 10L),
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L),
                sanitizeInt(file.agentMaxConcurrency(), defaults.agentMaxConcurrency(), 1)
        );
    }

    public MeshSettings withEnvironment(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return this;
        }
        return new MeshSettings(
                sanitizeText(env.get(ENV_BROKER_URL), brokerUrl),
                sanitizeText(env.get(ENV_MEMORY_PATH), memoryPath),
                envLong(env, ENV_HEARTBEAT_INTERVAL_MS, heartbeatIntervalMs, 10L),
                envInt(env, ENV_DISPATCH_MAX_ATTEMPTS, dispatchMaxAttempts, 1),
                envLong(env, ENV_REQUEST_TIMEOUT_MS, requestTimeoutMs, 10L),
                dispatchBaseBackoffMs,
                dispatchMaxBackoffMs,
                dispatchPollIntervalMs,
                submissionDeadlineMs,
                publishMaxAttempts,
                publishBaseBackoffMs,
                publishMaxBackoffMs,
                redeliveryLimit,
                memorySweepIntervalMs,
                shutdownGraceMs,
                agentMaxConcurrency
        );
    }

    public MeshSettings withMemoryPath(String path) {
        return new MeshSettings(
                brokerUrl,
                path,
                heartbeatIntervalMs,
                dispatchMaxAttempts,
                requestTimeoutMs,
                dispatchBaseBackoffMs,
                dispatchMaxBackoffMs,
                dispatchPollIntervalMs,
                submissionDeadlineMs,
                publishMaxAttempts,
                publishBaseBackoffMs,
                publishMaxBackoffMs,
                redeliveryLimit,
                memorySweepIntervalMs,
                shutdownGraceMs,
                agentMaxConcurrency
        );
    }

    /** Window after which a silent agent is considered unhealthy. */
    public long heartbeatTimeoutMs() {
        return heartbeatIntervalMs * 3L;
    }

    private static long envLong(Map<String, String> env, String name, long fallback, long min) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + raw, e);
        }
        if (parsed < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", got " + parsed);
        }
        return parsed;
    }

    private static int envInt(Map<String, String> env, String name, int fallback, int min) {
        long parsed = envLong(env, name, fallback, min);
        if (parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be <= " + Integer.MAX_VALUE + ", got " + parsed);
        }
        return (int) parsed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    record SettingsFile(
            String brokerUrl,
            String memoryPath,
            Long heartbeatIntervalMs,
            Integer dispatchMaxAttempts,
            Long requestTimeoutMs,
            Long dispatchBaseBackoffMs,
            Long dispatchMaxBackoffMs,
            Long dispatchPollIntervalMs,
            Long submissionDeadlineMs,
            Integer publishMaxAttempts,
            Long publishBaseBackoffMs,
            Long publishMaxBackoffMs,
            Integer redeliveryLimit,
            Long memorySweepIntervalMs,
            Long shutdownGraceMs,
            Integer agentMaxConcurrency
    ) {
    }
}
