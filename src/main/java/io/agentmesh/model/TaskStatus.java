package io.agentmesh.model;

public enum TaskStatus {
    PENDING,
    DISPATCHED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
