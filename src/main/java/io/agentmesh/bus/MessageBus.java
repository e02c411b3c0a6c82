package io.agentmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.Message;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Topic-addressed publish/subscribe with request/response on top.
 * Delivery is at-least-once; order is kept per publisher and topic only.
 */
public interface MessageBus extends AutoCloseable {
    String clientId();

    /**
     * Publishes an EVENT. Transport failures are retried with backoff.
     *
     * @return the message as handed to the broker
     * @throws BusUnavailableException once retries are exhausted
     */
    Message publish(String topic, JsonNode payload);

    /** Broadcast subscription: this handler receives its own copy of every message. */
    Subscription subscribe(String topic, MessageHandler handler);

    /** Competing-consumer subscription: one member of {@code group} receives each message. */
    Subscription subscribe(String topic, String group, MessageHandler handler);

    /**
     * Sends a REQUEST and waits for the RESPONSE carrying the same correlation id.
     *
     * @throws RequestTimeoutException when no matching response arrives in time
     * @throws BusUnavailableException when the request cannot be published
     */
    Message request(String topic, JsonNode payload, Duration timeout);

    /**
     * Future form of {@link #request}. Cancelling the future releases the reply
     * subscription; a response arriving afterwards is discarded.
     */
    CompletableFuture<Message> requestAsync(String topic, JsonNode payload, Duration timeout);

    /**
     * Publishes a RESPONSE to {@code request.replyTo()}.
     *
     * @throws IllegalArgumentException when the request carries no reply topic
     */
    Message respond(Message request, JsonNode payload);

    BusStats stats();

    @Override
    void close();
}
