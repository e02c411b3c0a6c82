package io.agentmesh.orchestrator;

public final class NoEligibleAgentException extends RuntimeException {
    private final String capability;

    public NoEligibleAgentException(String capability, long waitedMs) {
        super("No eligible agent for capability '" + capability + "' after " + waitedMs + "ms");
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
