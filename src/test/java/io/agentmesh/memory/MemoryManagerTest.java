package io.agentmesh.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

final class MemoryManagerTest {
    private final AtomicLong clock = new AtomicLong(1_000_000L);

    private MemoryManager newManager() {
        return new MemoryManager(new InMemoryDurableStore(), new WorkingMemoryStore(), AuditLogger.discarding(), clock::get);
    }

    @Test
    void workingItemIsGoneOnceTtlElapses() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.WORKING, "k", TextNode.valueOf("v"), Duration.ofMillis(100));

        Assertions.assertEquals("v", memory.require(MemoryType.WORKING, "k").value().asText());

        clock.addAndGet(150L);
        Assertions.assertTrue(memory.retrieve(MemoryType.WORKING, "k").isEmpty());
        MemoryNotFoundException error = Assertions.assertThrows(MemoryNotFoundException.class,
                () -> memory.require(MemoryType.WORKING, "k"));
        Assertions.assertEquals(MemoryType.WORKING, error.type());
        Assertions.assertEquals("k", error.key());
    }

    @Test
    void workingItemExpiresInRealTime() throws Exception {
        MemoryManager memory = MemoryManager.inMemory();
        memory.store(MemoryType.WORKING, "session", TextNode.valueOf("scratch"), Duration.ofMillis(100));
        Thread.sleep(150L);
        Assertions.assertThrows(MemoryNotFoundException.class, () -> memory.require(MemoryType.WORKING, "session"));
    }

    @Test
    void laterStoreOverwritesEarlierValue() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.SEMANTIC, "fact", TextNode.valueOf("v1"));
        clock.addAndGet(5L);
        memory.store(MemoryType.SEMANTIC, "fact", TextNode.valueOf("v2"));

        MemoryItem item = memory.require(MemoryType.SEMANTIC, "fact");
        Assertions.assertEquals("v2", item.value().asText());
        Assertions.assertEquals(clock.get(), item.storedAtMs());
        Assertions.assertEquals(1L, memory.stats().of(MemoryType.SEMANTIC).count());
    }

    @Test
    void sameKeyUnderDifferentTypesIsIndependent() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.EPISODIC, "shared", TextNode.valueOf("episode"));
        memory.store(MemoryType.PROCEDURAL, "shared", TextNode.valueOf("procedure"));

        Assertions.assertEquals("episode", memory.require(MemoryType.EPISODIC, "shared").value().asText());
        Assertions.assertEquals("procedure", memory.require(MemoryType.PROCEDURAL, "shared").value().asText());
    }

    @Test
    void ttlRulesAreEnforcedPerType() {
        MemoryManager memory = newManager();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> memory.store(MemoryType.WORKING, "k", TextNode.valueOf("v")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> memory.store(MemoryType.EPISODIC, "k", TextNode.valueOf("v"), Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> memory.store(MemoryType.WORKING, "k", TextNode.valueOf("v"), Duration.ZERO));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> memory.store(MemoryType.EMOTIONAL, " ", TextNode.valueOf("v")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> memory.store(MemoryType.EMOTIONAL, "k", null));
        Assertions.assertTrue(memory.retrieve(MemoryType.WORKING, "k").isEmpty());
    }

    @Test
    void storedJsonNullIsDistinctFromMissing() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.SEMANTIC, "nothing", NullNode.getInstance());

        Optional<MemoryItem> found = memory.retrieve(MemoryType.SEMANTIC, "nothing");
        Assertions.assertTrue(found.isPresent());
        Assertions.assertTrue(found.get().value().isNull());
        Assertions.assertTrue(memory.retrieve(MemoryType.SEMANTIC, "absent").isEmpty());
    }

    @Test
    void deleteRemovesItem() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.PROCEDURAL, "howto", TextNode.valueOf("steps"));

        Assertions.assertTrue(memory.delete(MemoryType.PROCEDURAL, "howto"));
        Assertions.assertFalse(memory.delete(MemoryType.PROCEDURAL, "howto"));
        Assertions.assertTrue(memory.retrieve(MemoryType.PROCEDURAL, "howto").isEmpty());
    }

    @Test
    void listIsOrderedByStoredAtThenKey() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.EPISODIC, "b", IntNode.valueOf(1));
        memory.store(MemoryType.EPISODIC, "a", IntNode.valueOf(2));
        clock.addAndGet(10L);
        memory.store(MemoryType.EPISODIC, "0-late", IntNode.valueOf(3));

        Assertions.assertEquals(List.of("a", "b", "0-late"), keys(memory.list(MemoryType.EPISODIC)));
    }

    @Test
    void listIsLazyAndRestartable() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.SEMANTIC, "one", IntNode.valueOf(1));
        Iterable<MemoryItem> listing = memory.list(MemoryType.SEMANTIC);

        Assertions.assertEquals(List.of("one"), keys(listing));
        clock.addAndGet(1L);
        memory.store(MemoryType.SEMANTIC, "two", IntNode.valueOf(2));
        Assertions.assertEquals(List.of("one", "two"), keys(listing));
        Assertions.assertEquals(List.of("one", "two"), keys(listing));
    }

    @Test
    void listWalksManyPagesInOrder() {
        MemoryManager memory = newManager();
        for (int i = 0; i < 300; i++) {
            clock.incrementAndGet();
            memory.store(MemoryType.EPISODIC, String.format("item-%03d", i), IntNode.valueOf(i));
        }

        List<String> keys = keys(memory.list(MemoryType.EPISODIC));
        Assertions.assertEquals(300, keys.size());
        Assertions.assertEquals("item-000", keys.get(0));
        Assertions.assertEquals("item-299", keys.get(299));
        Assertions.assertEquals(5, keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().limit(5).build())).size());
    }

    @Test
    void filterMatchesFieldsMetadataAndBounds() {
        MemoryManager memory = newManager();
        memory.store(MemoryType.EPISODIC, "photo/1", object("caption", "Sunset over the Bay"), null, Map.of("source", "camera"));
        clock.addAndGet(10L);
        ObjectNode nested = Jsons.object();
        nested.set("data", object("caption", "bay bridge at night"));
        memory.store(MemoryType.EPISODIC, "photo/2", nested, null, Map.of("source", "upload"));
        clock.addAndGet(10L);
        memory.store(MemoryType.EPISODIC, "note/1", object("caption", "grocery list"), null, Map.of("source", "camera"));
        Instant afterFirst = Instant.ofEpochMilli(clock.get() - 15L);

        Assertions.assertEquals(List.of("photo/1", "photo/2"),
                keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().field("caption", "BAY").build())));
        Assertions.assertEquals(List.of("photo/1", "note/1"),
                keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().metadata("source", "camera").build())));
        Assertions.assertEquals(List.of("photo/1", "photo/2"),
                keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().keyPrefix("photo/").build())));
        Assertions.assertEquals(List.of("photo/2", "note/1"),
                keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().storedAfter(afterFirst).build())));
        Assertions.assertEquals(List.of(),
                keys(memory.list(MemoryType.EPISODIC, MemoryFilter.builder().field("caption", IntNode.valueOf(3)).build())));
    }

    @Test
    void statsReportCountsAndBoundsWithoutExpiredWorkingItems() {
        MemoryManager memory = newManager();
        long first = clock.get();
        memory.store(MemoryType.EMOTIONAL, "calm", TextNode.valueOf("ok"));
        clock.addAndGet(20L);
        memory.store(MemoryType.EMOTIONAL, "alert", TextNode.valueOf("hmm"));
        memory.store(MemoryType.WORKING, "short", TextNode.valueOf("x"), Duration.ofMillis(10));
        memory.store(MemoryType.WORKING, "long", TextNode.valueOf("y"), Duration.ofSeconds(60));
        clock.addAndGet(15L);

        MemoryStats stats = memory.stats();
        Assertions.assertEquals(2L, stats.of(MemoryType.EMOTIONAL).count());
        Assertions.assertEquals(first, stats.of(MemoryType.EMOTIONAL).oldestMs());
        Assertions.assertEquals(first + 20L, stats.of(MemoryType.EMOTIONAL).newestMs());
        Assertions.assertEquals(1L, stats.of(MemoryType.WORKING).count());
        Assertions.assertEquals(0L, stats.of(MemoryType.SEMANTIC).count());
        Assertions.assertNull(stats.of(MemoryType.SEMANTIC).oldest());
    }

    @Test
    void sweepRemovesOnlyExpiredWorkingItems() {
        WorkingMemoryStore working = new WorkingMemoryStore();
        MemoryManager memory = new MemoryManager(new InMemoryDurableStore(), working, AuditLogger.discarding(), clock::get);
        memory.store(MemoryType.WORKING, "a", TextNode.valueOf("1"), Duration.ofMillis(10));
        memory.store(MemoryType.WORKING, "b", TextNode.valueOf("2"), Duration.ofMillis(10));
        memory.store(MemoryType.WORKING, "c", TextNode.valueOf("3"), Duration.ofMillis(500));
        clock.addAndGet(50L);

        Assertions.assertEquals(2, memory.sweepExpired());
        Assertions.assertEquals(1, working.size());
        Assertions.assertEquals(0, memory.sweepExpired());
    }

    @Test
    void backgroundSweeperRemovesExpiredItems() throws Exception {
        WorkingMemoryStore working = new WorkingMemoryStore();
        try (MemoryManager memory = new MemoryManager(new InMemoryDurableStore(), working, AuditLogger.discarding())) {
            memory.store(MemoryType.WORKING, "temp", TextNode.valueOf("x"), Duration.ofMillis(20));
            memory.startSweeper(Duration.ofMillis(20));
            long deadline = System.currentTimeMillis() + 2_000L;
            while (working.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertEquals(0, working.size());
        }
    }

    @Test
    void concurrentWritersKeepOneValuePerKey() throws Exception {
        MemoryManager memory = MemoryManager.inMemory();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                int writer = t;
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 100; i++) {
                        memory.store(MemoryType.SEMANTIC, "shared", IntNode.valueOf(writer));
                        memory.store(MemoryType.SEMANTIC, "own-" + writer + "-" + i, IntNode.valueOf(i));
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            Assertions.assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        JsonNode shared = memory.require(MemoryType.SEMANTIC, "shared").value();
        Assertions.assertTrue(shared.asInt() >= 0 && shared.asInt() < 8);
        Assertions.assertEquals(801L, memory.stats().of(MemoryType.SEMANTIC).count());
    }

    private static ObjectNode object(String field, String value) {
        ObjectNode node = Jsons.object();
        node.put(field, value);
        return node;
    }

    private static List<String> keys(Iterable<MemoryItem> items) {
        List<String> out = new ArrayList<>();
        for (MemoryItem item : items) {
            out.add(item.key());
        }
        return out;
    }
}
