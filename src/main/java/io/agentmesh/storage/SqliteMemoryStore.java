package io.agentmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentmesh.memory.MemoryCursor;
import io.agentmesh.memory.MemoryStats;
import io.agentmesh.memory.MemoryStore;
import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;
import io.agentmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable memory backed by the {@code memory_items} table. One row per
 * {@code (memory_type, item_key)}; a later put replaces the row.
 */
public final class SqliteMemoryStore implements MemoryStore {
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private final Database database;

    public SqliteMemoryStore(Database database) {
        this.database = database;
    }

    public static SqliteMemoryStore open(Database database) {
        database.init();
        return new SqliteMemoryStore(database);
    }

    @Override
    public void put(MemoryItem item) {
        String sql = """
                INSERT INTO memory_items(memory_type,item_key,value_json,stored_at_ms,ttl_ms,metadata_json)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(memory_type,item_key) DO UPDATE SET
                    value_json=excluded.value_json,
                    stored_at_ms=excluded.stored_at_ms,
                    ttl_ms=excluded.ttl_ms,
                    metadata_json=excluded.metadata_json
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, item.type().name());
            ps.setString(2, item.key());
            ps.setString(3, Jsons.toCompactJson(item.value()));
            ps.setLong(4, item.storedAtMs());
            if (item.ttlMs() == null) {
                ps.setNull(5, Types.INTEGER);
            } else {
                ps.setLong(5, item.ttlMs());
            }
            ps.setString(6, Jsons.toCompactJson(item.metadata()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store memory item " + item.type() + "/" + item.key(), e);
        }
    }

    @Override
    public Optional<MemoryItem> get(MemoryType type, String key) {
        String sql = "SELECT memory_type,item_key,value_json,stored_at_ms,ttl_ms,metadata_json FROM memory_items WHERE memory_type=? AND item_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type.name());
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readItem(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read memory item " + type + "/" + key, e);
        }
    }

    @Override
    public boolean delete(MemoryType type, String key) {
        String sql = "DELETE FROM memory_items WHERE memory_type=? AND item_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type.name());
            ps.setString(2, key);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete memory item " + type + "/" + key, e);
        }
    }

    @Override
    public List<MemoryItem> page(MemoryType type, String keyPrefix, MemoryCursor cursor, int pageSize) {
        MemoryCursor after = cursor == null ? MemoryCursor.START : cursor;
        boolean prefixed = keyPrefix != null && !keyPrefix.isEmpty();
        String sql = """
                SELECT memory_type,item_key,value_json,stored_at_ms,ttl_ms,metadata_json
                FROM memory_items
                WHERE memory_type=?
                  AND (stored_at_ms>? OR (stored_at_ms=? AND item_key>?))
                """
                + (prefixed ? "  AND substr(item_key,1,?)=?\n" : "")
                + "ORDER BY stored_at_ms ASC, item_key ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, type.name());
            ps.setLong(idx++, after.storedAtMs());
            ps.setLong(idx++, after.storedAtMs());
            ps.setString(idx++, after.key());
            if (prefixed) {
                ps.setInt(idx++, keyPrefix.length());
                ps.setString(idx++, keyPrefix);
            }
            ps.setInt(idx, Math.max(1, pageSize));
            List<MemoryItem> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readItem(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list memory items of type " + type, e);
        }
    }

    @Override
    public MemoryStats.TypeStats stats(MemoryType type) {
        String sql = "SELECT COUNT(*) AS cnt, MIN(stored_at_ms) AS oldest, MAX(stored_at_ms) AS newest FROM memory_items WHERE memory_type=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return MemoryStats.TypeStats.EMPTY;
                long count = rs.getLong("cnt");
                if (count == 0L) return MemoryStats.TypeStats.EMPTY;
                return new MemoryStats.TypeStats(count, rs.getLong("oldest"), rs.getLong("newest"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute memory stats for " + type, e);
        }
    }

    private static MemoryItem readItem(ResultSet rs) throws SQLException {
        long ttl = rs.getLong("ttl_ms");
        Long ttlMs = rs.wasNull() ? null : ttl;
        return new MemoryItem(
                MemoryType.fromString(rs.getString("memory_type")),
                rs.getString("item_key"),
                Jsons.parse(rs.getString("value_json")),
                rs.getLong("stored_at_ms"),
                ttlMs,
                readMetadata(rs.getString("metadata_json"))
        );
    }

    private static Map<String, String> readMetadata(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(raw, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt memory metadata: " + raw, e);
        }
    }
}
