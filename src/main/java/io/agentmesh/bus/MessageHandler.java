package io.agentmesh.bus;

import io.agentmesh.model.Message;

@FunctionalInterface
public interface MessageHandler {
    /**
     * Handles one delivery. Throwing asks the broker to redeliver the message,
     * up to its redelivery limit.
     */
    void handle(Message message) throws Exception;
}
