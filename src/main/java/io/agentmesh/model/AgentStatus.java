package io.agentmesh.model;

public enum AgentStatus {
    STARTING,
    READY,
    BUSY,
    UNHEALTHY,
    STOPPED;

    public static AgentStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("agent status cannot be empty");
        }
        for (AgentStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + raw);
    }
}
