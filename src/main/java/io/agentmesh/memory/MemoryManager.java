package io.agentmesh.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Threads;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Typed memory facade shared by agents. Durable types go to the durable store,
 * WORKING items to the in-process TTL store. Operations on one
 * {@code (type, key)} are serialized through a striped lock.
 */
public final class MemoryManager implements AutoCloseable {
    private static final int LOCK_STRIPES = 64;
    private static final int PAGE_SIZE = 128;

    private final MemoryStore durableStore;
    private final WorkingMemoryStore workingStore;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;
    private final ReentrantLock[] stripes;
    private ScheduledExecutorService sweeper;

    public MemoryManager(MemoryStore durableStore, WorkingMemoryStore workingStore, AuditLogger auditLogger) {
        this(durableStore, workingStore, auditLogger, System::currentTimeMillis);
    }

    public MemoryManager(MemoryStore durableStore, WorkingMemoryStore workingStore, AuditLogger auditLogger, LongSupplier clock) {
        if (durableStore == null || workingStore == null) {
            throw new IllegalArgumentException("memory stores cannot be null");
        }
        this.durableStore = durableStore;
        this.workingStore = workingStore;
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
        this.clock = clock;
        this.stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public static MemoryManager inMemory() {
        return new MemoryManager(new InMemoryDurableStore(), new WorkingMemoryStore(), AuditLogger.discarding());
    }

    public MemoryItem store(MemoryType type, String key, JsonNode value) {
        return store(type, key, value, null, Map.of());
    }

    public MemoryItem store(MemoryType type, String key, JsonNode value, Duration ttl) {
        return store(type, key, value, ttl, Map.of());
    }

    /**
     * Stores or overwrites the item at {@code (type, key)}.
     *
     * @throws IllegalArgumentException when WORKING lacks a ttl, a durable type
     *                                  carries one, the ttl is not positive, the key is blank or the value is null
     */
    public MemoryItem store(MemoryType type, String key, JsonNode value, Duration ttl, Map<String, String> metadata) {
        if (type == null) {
            throw new IllegalArgumentException("memory type is required");
        }
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("memory value cannot be null; store a JSON null node instead");
        }
        if (type == MemoryType.WORKING && ttl == null) {
            throw new IllegalArgumentException("WORKING memory requires a ttl");
        }
        if (type != MemoryType.WORKING && ttl != null) {
            throw new IllegalArgumentException(type + " memory does not accept a ttl");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        MemoryItem item = new MemoryItem(
                type,
                key,
                value,
                clock.getAsLong(),
                ttl == null ? null : ttl.toMillis(),
                metadata
        );
        ReentrantLock lock = lockFor(type, key);
        lock.lock();
        try {
            storeFor(type).put(item);
        } finally {
            lock.unlock();
        }
        return item;
    }

    /** Looks up an item; an expired WORKING item is removed and reported absent. */
    public Optional<MemoryItem> retrieve(MemoryType type, String key) {
        requireType(type);
        requireKey(key);
        ReentrantLock lock = lockFor(type, key);
        lock.lock();
        try {
            Optional<MemoryItem> found = storeFor(type).get(type, key);
            if (found.isPresent() && found.get().expiredAt(clock.getAsLong())) {
                workingStore.delete(type, key);
                return Optional.empty();
            }
            return found;
        } finally {
            lock.unlock();
        }
    }

    public MemoryItem require(MemoryType type, String key) {
        return retrieve(type, key).orElseThrow(() -> new MemoryNotFoundException(type, key));
    }

    public boolean delete(MemoryType type, String key) {
        requireType(type);
        requireKey(key);
        ReentrantLock lock = lockFor(type, key);
        lock.lock();
        try {
            return storeFor(type).delete(type, key);
        } finally {
            lock.unlock();
        }
    }

    public Iterable<MemoryItem> list(MemoryType type) {
        return list(type, MemoryFilter.all());
    }

    /**
     * Lazy listing ordered by storedAt then key. Each {@code iterator()} call
     * runs the query again, reading the store a page at a time.
     */
    public Iterable<MemoryItem> list(MemoryType type, MemoryFilter filter) {
        requireType(type);
        MemoryFilter safeFilter = filter == null ? MemoryFilter.all() : filter;
        return () -> new PagedIterator(type, safeFilter);
    }

    public MemoryStats stats() {
        Map<MemoryType, MemoryStats.TypeStats> byType = new EnumMap<>(MemoryType.class);
        for (MemoryType type : MemoryType.values()) {
            byType.put(type, type.durable() ? durableStore.stats(type) : workingStore.stats(clock.getAsLong()));
        }
        return new MemoryStats(byType);
    }

    /** Removes expired WORKING items and returns how many were removed. */
    public int sweepExpired() {
        long nowMs = clock.getAsLong();
        int removed = 0;
        for (String key : workingStore.expiredKeys(nowMs)) {
            ReentrantLock lock = lockFor(MemoryType.WORKING, key);
            lock.lock();
            try {
                Optional<MemoryItem> current = workingStore.get(MemoryType.WORKING, key);
                if (current.isPresent() && current.get().expiredAt(nowMs) && workingStore.delete(MemoryType.WORKING, key)) {
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        if (removed > 0) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.sweep",
                    "memory",
                    "memory/working",
                    "ok",
                    Map.of("removed", removed)
            ));
        }
        return removed;
    }

    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null) {
            return;
        }
        long periodMs = Math.max(10L, interval.toMillis());
        sweeper = Executors.newSingleThreadScheduledExecutor(Threads.daemon("memory-sweep"));
        sweeper.scheduleWithFixedDelay(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        durableStore.close();
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.sweep",
                    "memory",
                    "memory/working",
                    "error",
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
    }

    private MemoryStore storeFor(MemoryType type) {
        return type.durable() ? durableStore : workingStore;
    }

    private ReentrantLock lockFor(MemoryType type, String key) {
        int hash = 31 * type.hashCode() + key.hashCode();
        return stripes[Math.floorMod(hash, LOCK_STRIPES)];
    }

    private static void requireType(MemoryType type) {
        if (type == null) {
            throw new IllegalArgumentException("memory type is required");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("memory key cannot be empty");
        }
    }

    private final class PagedIterator implements Iterator<MemoryItem> {
        private final MemoryType type;
        private final MemoryFilter filter;
        private final Deque<MemoryItem> buffer = new ArrayDeque<>();
        private MemoryCursor cursor = MemoryCursor.START;
        private boolean exhausted;
        private int returned;

        PagedIterator(MemoryType type, MemoryFilter filter) {
            this.type = type;
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            if (filter.limit() > 0 && returned >= filter.limit()) {
                return false;
            }
            while (buffer.isEmpty() && !exhausted) {
                fill();
            }
            return !buffer.isEmpty();
        }

        @Override
        public MemoryItem next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            returned++;
            return buffer.removeFirst();
        }

        private void fill() {
            List<MemoryItem> page = storeFor(type).page(type, filter.keyPrefix(), cursor, PAGE_SIZE);
            if (page.size() < PAGE_SIZE) {
                exhausted = true;
            }
            long nowMs = clock.getAsLong();
            for (MemoryItem item : page) {
                cursor = MemoryCursor.after(item);
                if (!item.expiredAt(nowMs) && filter.matches(item)) {
                    buffer.addLast(item);
                }
            }
        }
    }
}
