package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.model.MemoryType;
import io.agentmesh.util.Jsons;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Echoes the task description back and keeps an episodic record of what it saw.
 */
public final class EchoAgent implements Agent {
    public static final String TYPE = "echo";

    @Override
    public String agentType() {
        return TYPE;
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("echo");
    }

    @Override
    public AgentResult receive(AgentContext context) {
        JsonNode payload = context.payload();
        JsonNode received = payload.has("description") ? payload.get("description") : payload;

        ObjectNode output = Jsons.object();
        output.put("agent", TYPE);
        output.put("agent_id", context.agentId());
        output.put("timestamp", Instant.now().toString());
        output.set("received", received);

        ObjectNode episode = Jsons.object();
        episode.put("message_id", context.message().messageId());
        episode.put("task_id", context.taskId());
        episode.set("data", received);
        context.memory().store(
                MemoryType.EPISODIC,
                "echo/" + context.message().messageId(),
                episode,
                null,
                Map.of("agent_id", context.agentId(), "topic", context.message().topic())
        );
        return AgentResult.ok(output);
    }
}
