package io.agentmesh.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentmesh.model.MemoryItem;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured filter for {@link MemoryManager#list}. All set conditions must hold.
 *
 * <p>Value field conditions look at the top-level field of an object value
 * first, then at the same field inside a nested {@code data} object. Textual
 * expectations match as case-insensitive substrings; anything else must be equal.
 */
public final class MemoryFilter {
    private static final MemoryFilter ALL = new Builder().build();

    private final String keyPrefix;
    private final Map<String, String> metadata;
    private final Map<String, JsonNode> fields;
    private final Long storedAfterMs;
    private final Long storedBeforeMs;
    private final int limit;

    private MemoryFilter(Builder builder) {
        this.keyPrefix = builder.keyPrefix;
        this.metadata = Map.copyOf(builder.metadata);
        this.fields = Map.copyOf(builder.fields);
        this.storedAfterMs = builder.storedAfterMs;
        this.storedBeforeMs = builder.storedBeforeMs;
        this.limit = builder.limit;
    }

    public static MemoryFilter all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    /** Maximum number of items; {@code 0} means unbounded. */
    public int limit() {
        return limit;
    }

    public boolean matches(MemoryItem item) {
        if (keyPrefix != null && !item.key().startsWith(keyPrefix)) {
            return false;
        }
        if (storedAfterMs != null && item.storedAtMs() <= storedAfterMs) {
            return false;
        }
        if (storedBeforeMs != null && item.storedAtMs() >= storedBeforeMs) {
            return false;
        }
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (!e.getValue().equals(item.metadata().get(e.getKey()))) {
                return false;
            }
        }
        for (Map.Entry<String, JsonNode> e : fields.entrySet()) {
            if (!fieldMatches(item.value(), e.getKey(), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean fieldMatches(JsonNode value, String field, JsonNode expected) {
        if (value == null || !value.isObject()) {
            return false;
        }
        JsonNode actual = value.get(field);
        if (actual == null) {
            JsonNode data = value.get("data");
            actual = data != null && data.isObject() ? data.get(field) : null;
        }
        if (actual == null) {
            return false;
        }
        if (expected.isTextual() && actual.isTextual()) {
            return actual.asText().toLowerCase(Locale.ROOT).contains(expected.asText().toLowerCase(Locale.ROOT));
        }
        return expected.equals(actual);
    }

    public static final class Builder {
        private String keyPrefix;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private final Map<String, JsonNode> fields = new LinkedHashMap<>();
        private Long storedAfterMs;
        private Long storedBeforeMs;
        private int limit;

        private Builder() {
        }

        public Builder keyPrefix(String prefix) {
            this.keyPrefix = prefix == null || prefix.isEmpty() ? null : prefix;
            return this;
        }

        public Builder metadata(String name, String value) {
            if (name == null || name.isBlank() || value == null) {
                throw new IllegalArgumentException("metadata filter needs a name and a value");
            }
            metadata.put(name, value);
            return this;
        }

        public Builder field(String name, JsonNode expected) {
            if (name == null || name.isBlank() || expected == null) {
                throw new IllegalArgumentException("field filter needs a name and a value");
            }
            fields.put(name, expected.deepCopy());
            return this;
        }

        public Builder field(String name, String expected) {
            return field(name, expected == null ? null : TextNode.valueOf(expected));
        }

        public Builder storedAfter(Instant instant) {
            this.storedAfterMs = instant == null ? null : instant.toEpochMilli();
            return this;
        }

        public Builder storedBefore(Instant instant) {
            this.storedBeforeMs = instant == null ? null : instant.toEpochMilli();
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0");
            }
            this.limit = limit;
            return this;
        }

        public MemoryFilter build() {
            return new MemoryFilter(this);
        }
    }
}
