package io.agentmesh.memory;

import io.agentmesh.model.MemoryItem;

/**
 * Keyset position in the {@code (storedAt, key)} listing order. Pages start
 * strictly after the cursor.
 */
public record MemoryCursor(long storedAtMs, String key) {
    public static final MemoryCursor START = new MemoryCursor(Long.MIN_VALUE, "");

    public static MemoryCursor after(MemoryItem item) {
        return new MemoryCursor(item.storedAtMs(), item.key());
    }

    public boolean before(MemoryItem item) {
        if (item.storedAtMs() != storedAtMs) {
            return item.storedAtMs() > storedAtMs;
        }
        return item.key().compareTo(key) > 0;
    }
}
