package io.agentmesh.memory;

import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process store for WORKING memory. Items carry a ttl; expired entries are
 * reported by {@link #expiredKeys(long)} and removed by the manager's sweep.
 */
public final class WorkingMemoryStore implements MemoryStore {
    private final Map<String, MemoryItem> items = new ConcurrentHashMap<>();

    @Override
    public void put(MemoryItem item) {
        requireWorking(item.type());
        items.put(item.key(), item);
    }

    @Override
    public Optional<MemoryItem> get(MemoryType type, String key) {
        requireWorking(type);
        return Optional.ofNullable(items.get(key));
    }

    @Override
    public boolean delete(MemoryType type, String key) {
        requireWorking(type);
        return items.remove(key) != null;
    }

    @Override
    public List<MemoryItem> page(MemoryType type, String keyPrefix, MemoryCursor cursor, int pageSize) {
        requireWorking(type);
        return MemoryStore.pageOf(new ArrayList<>(items.values()), keyPrefix, cursor, pageSize);
    }

    @Override
    public MemoryStats.TypeStats stats(MemoryType type) {
        requireWorking(type);
        return stats(Long.MIN_VALUE);
    }

    /** Live-item stats as of {@code nowMs}; expired items are left out. */
    public MemoryStats.TypeStats stats(long nowMs) {
        MemoryStats.TypeStats stats = MemoryStats.TypeStats.EMPTY;
        for (MemoryItem item : items.values()) {
            if (!item.expiredAt(nowMs)) {
                stats = stats.include(item.storedAtMs());
            }
        }
        return stats;
    }

    public List<String> expiredKeys(long nowMs) {
        List<String> out = new ArrayList<>();
        for (MemoryItem item : items.values()) {
            if (item.expiredAt(nowMs)) {
                out.add(item.key());
            }
        }
        return out;
    }

    public int size() {
        return items.size();
    }

    private static void requireWorking(MemoryType type) {
        if (type != MemoryType.WORKING) {
            throw new IllegalArgumentException("Working memory store only holds WORKING items, got " + type);
        }
    }
}
