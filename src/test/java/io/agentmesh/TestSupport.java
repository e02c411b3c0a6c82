package io.agentmesh;

import io.agentmesh.config.MeshSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

public final class TestSupport {
    private TestSupport() {
    }

    public static SettingsBuilder settings() {
        return new SettingsBuilder();
    }

    public static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10L);
        }
        return condition.getAsBoolean();
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /** Short intervals so lifecycle tests finish quickly. */
    public static final class SettingsBuilder {
        private String brokerUrl = "memory://test";
        private String memoryPath;
        private long heartbeatIntervalMs = 50L;
        private int dispatchMaxAttempts = 3;
        private long requestTimeoutMs = 1_000L;
        private long dispatchBaseBackoffMs = 10L;
        private long dispatchMaxBackoffMs = 50L;
        private long dispatchPollIntervalMs = 20L;
        private long submissionDeadlineMs = 2_000L;
        private int publishMaxAttempts = 3;
        private long publishBaseBackoffMs = 5L;
        private long publishMaxBackoffMs = 20L;
        private int redeliveryLimit = 2;
        private long memorySweepIntervalMs = 50L;
        private long shutdownGraceMs = 1_000L;
        private int agentMaxConcurrency = 2;

        public SettingsBuilder memoryPath(String value) {
            this.memoryPath = value;
            return this;
        }

        public SettingsBuilder brokerUrl(String value) {
            this.brokerUrl = value;
            return this;
        }

        public SettingsBuilder heartbeatIntervalMs(long value) {
            this.heartbeatIntervalMs = value;
            return this;
        }

        public SettingsBuilder dispatchMaxAttempts(int value) {
            this.dispatchMaxAttempts = value;
            return this;
        }

        public SettingsBuilder requestTimeoutMs(long value) {
            this.requestTimeoutMs = value;
            return this;
        }

        public SettingsBuilder submissionDeadlineMs(long value) {
            this.submissionDeadlineMs = value;
            return this;
        }

        public SettingsBuilder shutdownGraceMs(long value) {
            this.shutdownGraceMs = value;
            return this;
        }

        public SettingsBuilder agentMaxConcurrency(int value) {
            this.agentMaxConcurrency = value;
            return this;
        }

        public MeshSettings build() {
            return new MeshSettings(
                    brokerUrl,
                    memoryPath,
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
    }
}
