package io.agentmesh.memory;

import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Storage backend for memory items keyed by {@code (type, key)}. Backends do
 * no expiry or validation; {@link MemoryManager} owns both.
 */
public interface MemoryStore extends AutoCloseable {
    Comparator<MemoryItem> LISTING_ORDER = Comparator
            .comparingLong(MemoryItem::storedAtMs)
            .thenComparing(MemoryItem::key);

    /** Inserts or replaces the item at {@code (item.type(), item.key())}. */
    void put(MemoryItem item);

    Optional<MemoryItem> get(MemoryType type, String key);

    boolean delete(MemoryType type, String key);

    /**
     * Returns up to {@code pageSize} items of {@code type} strictly after
     * {@code cursor} in listing order, optionally restricted to a key prefix.
     */
    List<MemoryItem> page(MemoryType type, String keyPrefix, MemoryCursor cursor, int pageSize);

    MemoryStats.TypeStats stats(MemoryType type);

    @Override
    default void close() {
    }

    static List<MemoryItem> pageOf(Collection<MemoryItem> items, String keyPrefix, MemoryCursor cursor, int pageSize) {
        List<MemoryItem> matching = new ArrayList<>();
        for (MemoryItem item : items) {
            if (keyPrefix != null && !item.key().startsWith(keyPrefix)) {
                continue;
            }
            if (cursor != null && !cursor.before(item)) {
                continue;
            }
            matching.add(item);
        }
        matching.sort(LISTING_ORDER);
        return matching.size() <= pageSize ? matching : new ArrayList<>(matching.subList(0, pageSize));
    }
}
