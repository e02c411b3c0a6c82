package io.agentmesh.orchestrator;

import io.agentmesh.model.AgentStatus;

public record PingResult(
        String agentId,
        AgentStatus status,
        long lastHeartbeatMs,
        long silenceMs
) {
}
