package io.agentmesh.bus;

import io.agentmesh.model.Message;

/**
 * Broker seam used by the bus client. Implementations deliver each message to
 * every broadcast subscription of its topic and to one member of every
 * consumer group on that topic.
 */
public interface BusTransport extends AutoCloseable {
    String endpoint();

    /**
     * Hands a message to the broker.
     *
     * @throws BusUnavailableException when the broker cannot accept it
     */
    void send(Message message);

    Subscription open(String topic, String group, MessageHandler handler);

    BusStats stats();

    @Override
    void close();
}
