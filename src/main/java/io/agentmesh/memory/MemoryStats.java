package io.agentmesh.memory;

import io.agentmesh.model.MemoryType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record MemoryStats(Map<MemoryType, TypeStats> byType) {
    public MemoryStats {
        EnumMap<MemoryType, TypeStats> copy = new EnumMap<>(MemoryType.class);
        for (MemoryType type : MemoryType.values()) {
            TypeStats stats = byType == null ? null : byType.get(type);
            copy.put(type, stats == null ? TypeStats.EMPTY : stats);
        }
        byType = Collections.unmodifiableMap(copy);
    }

    public TypeStats of(MemoryType type) {
        return byType.get(type);
    }

    public long totalCount() {
        long total = 0L;
        for (TypeStats stats : byType.values()) {
            total += stats.count();
        }
        return total;
    }

    public record TypeStats(long count, Long oldestMs, Long newestMs) {
        public static final TypeStats EMPTY = new TypeStats(0L, null, null);

        public Instant oldest() {
            return oldestMs == null ? null : Instant.ofEpochMilli(oldestMs);
        }

        public Instant newest() {
            return newestMs == null ? null : Instant.ofEpochMilli(newestMs);
        }

        public TypeStats include(long storedAtMs) {
            return new TypeStats(
                    count + 1L,
                    oldestMs == null ? storedAtMs : Math.min(oldestMs, storedAtMs),
                    newestMs == null ? storedAtMs : Math.max(newestMs, storedAtMs)
            );
        }
    }
}
