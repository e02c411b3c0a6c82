package io.agentmesh.agent;

public enum AgentRuntimeState {
    CREATED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED;

    public boolean canTransitionTo(AgentRuntimeState next) {
        return switch (this) {
            case CREATED -> next == STARTING;
            case STARTING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == STOPPING || next == FAILED;
            case STOPPING -> next == STOPPED;
            case STOPPED, FAILED -> false;
        };
    }

    public boolean terminal() {
        return this == STOPPED || this == FAILED;
    }
}
