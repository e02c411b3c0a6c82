package io.agentmesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Unit of communication on the bus. Immutable once built; the payload tree is
 * copied on construction so later mutation by the sender cannot leak into
 * delivered copies.
 */
public record Message(
        String messageId,
        String topic,
        JsonNode payload,
        String correlationId,
        String replyTo,
        long sentAtMs,
        MessageKind kind,
        String sender
) {
    public Message {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("message topic cannot be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("message kind cannot be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("message correlation id cannot be empty");
        }
        messageId = messageId == null || messageId.isBlank() ? newMessageId() : messageId;
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        replyTo = replyTo == null || replyTo.isBlank() ? null : replyTo;
        sender = sender == null || sender.isBlank() ? "anonymous" : sender;
    }

    public static Message event(String sender, String topic, JsonNode payload) {
        return new Message(
                newMessageId(),
                topic,
                payload,
                newCorrelationId(),
                null,
                Instant.now().toEpochMilli(),
                MessageKind.EVENT,
                sender
        );
    }

    public static Message request(String sender, String topic, JsonNode payload, String correlationId, String replyTo) {
        if (replyTo == null || replyTo.isBlank()) {
            throw new IllegalArgumentException("request must carry a reply topic");
        }
        return new Message(
                newMessageId(),
                topic,
                payload,
                correlationId,
                replyTo,
                Instant.now().toEpochMilli(),
                MessageKind.REQUEST,
                sender
        );
    }

    public static Message response(String sender, Message request, JsonNode payload) {
        if (request == null || request.replyTo() == null) {
            throw new IllegalArgumentException("cannot respond to a message without reply topic");
        }
        return new Message(
                newMessageId(),
                request.replyTo(),
                payload,
                request.correlationId(),
                null,
                Instant.now().toEpochMilli(),
                MessageKind.RESPONSE,
                sender
        );
    }

    public Instant sentAt() {
        return Instant.ofEpochMilli(sentAtMs);
    }

    public static String newCorrelationId() {
        return "cor_" + UUID.randomUUID();
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID();
    }
}
