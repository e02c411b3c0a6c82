package io.agentmesh.bus;

import java.time.Duration;

public final class RequestTimeoutException extends RuntimeException {
    private final String topic;
    private final String correlationId;
    private final Duration timeout;

    public RequestTimeoutException(String topic, String correlationId, Duration timeout) {
        super("No response on " + topic + " within " + timeout.toMillis() + "ms (correlation_id=" + correlationId + ")");
        this.topic = topic;
        this.correlationId = correlationId;
        this.timeout = timeout;
    }

    public String topic() {
        return topic;
    }

    public String correlationId() {
        return correlationId;
    }

    public Duration timeout() {
        return timeout;
    }
}
