package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.Message;

@FunctionalInterface
public interface EventPublisher {
    Message publish(String topic, JsonNode payload);
}
