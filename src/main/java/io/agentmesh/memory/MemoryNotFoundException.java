package io.agentmesh.memory;

import io.agentmesh.model.MemoryType;

public final class MemoryNotFoundException extends RuntimeException {
    private final MemoryType type;
    private final String key;

    public MemoryNotFoundException(MemoryType type, String key) {
        super("Memory not found: " + type + "/" + key);
        this.type = type;
        this.key = key;
    }

    public MemoryType type() {
        return type;
    }

    public String key() {
        return key;
    }
}
