package io.agentmesh.memory;

import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for the durable memory types. Contents live as long as
 * the process; used by nodes without a memory path and by tests.
 */
public final class InMemoryDurableStore implements MemoryStore {
    private final Map<MemoryType, Map<String, MemoryItem>> items = new ConcurrentHashMap<>();

    @Override
    public void put(MemoryItem item) {
        bucket(item.type()).put(item.key(), item);
    }

    @Override
    public Optional<MemoryItem> get(MemoryType type, String key) {
        return Optional.ofNullable(bucket(type).get(key));
    }

    @Override
    public boolean delete(MemoryType type, String key) {
        return bucket(type).remove(key) != null;
    }

    @Override
    public List<MemoryItem> page(MemoryType type, String keyPrefix, MemoryCursor cursor, int pageSize) {
        return MemoryStore.pageOf(new ArrayList<>(bucket(type).values()), keyPrefix, cursor, pageSize);
    }

    @Override
    public MemoryStats.TypeStats stats(MemoryType type) {
        MemoryStats.TypeStats stats = MemoryStats.TypeStats.EMPTY;
        for (MemoryItem item : bucket(type).values()) {
            stats = stats.include(item.storedAtMs());
        }
        return stats;
    }

    private Map<String, MemoryItem> bucket(MemoryType type) {
        return items.computeIfAbsent(type, ignored -> new ConcurrentHashMap<>());
    }
}
