package io.agentmesh.bus;

public interface Subscription extends AutoCloseable {
    String topic();

    /** Consumer group name, or {@code null} for a broadcast subscription. */
    String group();

    boolean active();

    @Override
    void close();
}
