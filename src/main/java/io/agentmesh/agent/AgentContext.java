package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.model.Message;

public record AgentContext(
        String agentId,
        Message message,
        MemoryManager memory,
        EventPublisher events
) {
    public JsonNode payload() {
        return message.payload();
    }

    /** Task id of a dispatch request, or {@code null} for plain events. */
    public String taskId() {
        JsonNode taskId = message.payload().get("task_id");
        return taskId == null || taskId.isNull() ? null : taskId.asText();
    }

    public Message publish(String topic, JsonNode payload) {
        return events.publish(topic, payload);
    }
}
