package io.agentmesh.model;

import java.util.Set;

/**
 * Point-in-time view of a registry entry. The orchestrator hands these out;
 * the live entry stays private to the registry.
 */
public record AgentRecord(
        String agentId,
        String agentType,
        Set<String> capabilities,
        AgentStatus status,
        long lastHeartbeatMs,
        long registeredAtMs
) {
    public AgentRecord {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean eligibleFor(String capability) {
        return status == AgentStatus.READY && capabilities.contains(capability);
    }
}
