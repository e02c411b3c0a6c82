package io.agentmesh.model;

public enum MessageKind {
    EVENT,
    REQUEST,
    RESPONSE;

    public static MessageKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EVENT;
        }
        for (MessageKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + raw);
    }
}
