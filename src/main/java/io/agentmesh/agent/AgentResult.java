package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

public record AgentResult(
        boolean success,
        JsonNode output,
        String error,
        boolean fatal
) {
    public static AgentResult ok(JsonNode output) {
        return new AgentResult(true, output, null, false);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error, false);
    }

    /** Failure after which the agent should not keep running. */
    public static AgentResult fatal(String error) {
        return new AgentResult(false, null, error, true);
    }
}
