package io.agentmesh.model;

public enum MemoryType {
    EPISODIC(true),
    SEMANTIC(true),
    PROCEDURAL(true),
    EMOTIONAL(true),
    WORKING(false);

    private final boolean durable;

    MemoryType(boolean durable) {
        this.durable = durable;
    }

    public boolean durable() {
        return durable;
    }

    public static MemoryType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("memory type cannot be empty");
        }
        String normalized = raw.trim();
        for (MemoryType value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown memory type: " + raw);
    }
}
