package io.agentmesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record MemoryItem(
        MemoryType type,
        String key,
        JsonNode value,
        long storedAtMs,
        Long ttlMs,
        Map<String, String> metadata
) {
    public MemoryItem {
        value = value == null ? NullNode.getInstance() : value.deepCopy();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Instant storedAt() {
        return Instant.ofEpochMilli(storedAtMs);
    }

    public Duration ttl() {
        return ttlMs == null ? null : Duration.ofMillis(ttlMs);
    }

    public boolean expiredAt(long nowMs) {
        return ttlMs != null && storedAtMs + ttlMs <= nowMs;
    }
}
